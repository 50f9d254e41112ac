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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

/**
 * Opens {@link MemoryStore} handles bound to a project directory.
 */
@Component
@RequiredArgsConstructor
public class MemoryStoreFactory {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReportProperties properties;

    public MemoryStore open(String project) {
        ReportProperties.MemoryProperties memory = properties.getMemory();
        return new MemoryStore(storagePort, objectMapper, project, memory.getLogFile(), memory.getMemoryFile());
    }
}
