/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.report.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.ProjectSettings;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the project registry ({@code projects.json}, alias to repository
 * location) and per-project settings ({@code <project>/config.json}) from the
 * data root.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectSettingsService {

    private static final String ROOT = "";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReportProperties properties;

    public Map<String, String> loadAliases() {
        String json = storagePort.getText(ROOT, properties.getStorage().getProjectsFile()).join();
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json,
                    new TypeReference<LinkedHashMap<String, String>>() {
                    }));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed " + properties.getStorage().getProjectsFile() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    public Optional<String> resolveAlias(String project) {
        return Optional.ofNullable(loadAliases().get(project));
    }

    /**
     * Settings of a project; defaults when the project has no config file.
     */
    public ProjectSettings load(String project) {
        String json = storagePort.getText(project, properties.getStorage().getProjectConfigFile()).join();
        if (json == null || json.isBlank()) {
            return new ProjectSettings();
        }
        try {
            return objectMapper.readValue(json, ProjectSettings.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed settings for project '" + project + "': "
                    + e.getOriginalMessage(), e);
        }
    }

    public void save(String project, ProjectSettings settings) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
            storagePort.putTextAtomic(project, properties.getStorage().getProjectConfigFile(), json, true).join();
            log.info("[Projects] Saved settings for '{}'", project);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings for '" + project + "'", e);
        }
    }
}
