package me.golemcore.report.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.PromptStage;
import me.golemcore.report.domain.model.PromptTemplate;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves prompt templates by (provider, style, stage).
 *
 * <p>
 * Lookup order under {@code classpath:prompts/}:
 * <ol>
 * <li>{@code <provider>/<stage>-<style>.txt}</li>
 * <li>{@code default/<stage>-<style>.txt}</li>
 * <li>{@code <provider>/<stage>.txt}</li>
 * <li>{@code default/<stage>.txt}</li>
 * </ol>
 * A line containing only {@code ---} separates the system prompt from the user
 * prompt; without it the whole file is the user prompt.
 */
@Service
@Slf4j
public class PromptTemplateService {

    static final String DEFAULT_SCOPE = "default";
    private static final String ROOT = "prompts/";
    private static final String SEPARATOR = "\n---\n";

    private final String root;
    private final Map<String, Optional<PromptTemplate>> cache = new ConcurrentHashMap<>();

    public PromptTemplateService() {
        this(ROOT);
    }

    PromptTemplateService(String root) {
        this.root = root.endsWith("/") ? root : root + "/";
    }

    public PromptTemplate resolve(String provider, String style, PromptStage stage) {
        for (String candidate : candidates(provider, style, stage)) {
            Optional<PromptTemplate> template = cache.computeIfAbsent(candidate, this::load);
            if (template.isPresent()) {
                return template.get();
            }
        }
        throw new IllegalStateException("No prompt template for stage " + stage.getKey()
                + " (provider=" + provider + ", style=" + style + ")");
    }

    List<String> candidates(String provider, String style, PromptStage stage) {
        String providerKey = normalize(provider, DEFAULT_SCOPE);
        String styleKey = normalize(style, DEFAULT_SCOPE);
        String stem = stage.getKey();

        List<String> candidates = new ArrayList<>();
        if (!DEFAULT_SCOPE.equals(styleKey)) {
            candidates.add(root + providerKey + "/" + stem + "-" + styleKey + ".txt");
            candidates.add(root + DEFAULT_SCOPE + "/" + stem + "-" + styleKey + ".txt");
        }
        candidates.add(root + providerKey + "/" + stem + ".txt");
        candidates.add(root + DEFAULT_SCOPE + "/" + stem + ".txt");
        return candidates.stream().distinct().toList();
    }

    private Optional<PromptTemplate> load(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream is = resource.getInputStream()) {
            String text = new String(is.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
            log.debug("[Prompts] Loaded template: {}", location);
            return Optional.of(parse(text, location));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template: " + location, e);
        }
    }

    static PromptTemplate parse(String text, String source) {
        int separator = text.indexOf(SEPARATOR);
        if (separator < 0) {
            return new PromptTemplate("", text.strip(), source);
        }
        String system = text.substring(0, separator).strip();
        String user = text.substring(separator + SEPARATOR.length()).strip();
        return new PromptTemplate(system, user, source);
    }

    private static String normalize(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }
}
