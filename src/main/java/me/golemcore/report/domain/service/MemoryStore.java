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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.MemoryStoreException;
import me.golemcore.report.domain.model.MemoryLogEntry;
import me.golemcore.report.domain.model.ProjectMemory;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.port.outbound.StoragePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Passive per-project history storage: an append-only JSONL log with one
 * {@link MemoryLogEntry} per completed run, and a single distilled memory
 * document that is replaced wholesale.
 *
 * <p>
 * Both files are plain UTF-8 text and may be inspected or edited between runs.
 * Callers serialize access per project; this class does no locking and no
 * scheduling.
 */
@Slf4j
public class MemoryStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String project;
    private final String logFile;
    private final String memoryFile;

    public MemoryStore(StoragePort storagePort, ObjectMapper objectMapper, String project, String logFile,
            String memoryFile) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.project = project;
        this.logFile = logFile;
        this.memoryFile = memoryFile;
    }

    public String getProject() {
        return project;
    }

    /**
     * Append one entry as a single JSON line. Any failure is fatal.
     */
    public void append(MemoryLogEntry entry) {
        try {
            String line = objectMapper.writeValueAsString(entry);
            storagePort.appendText(project, logFile, line + "\n").join();
            log.info("[Memory] Appended log entry for {} ({})", project, entry.getDate());
        } catch (JsonProcessingException | CompletionException e) {
            throw new MemoryStoreException(RunStage.REDUCING,
                    "Failed to append to " + project + "/" + logFile, e);
        }
    }

    /**
     * All entries in file order. Lines that do not parse are skipped with a
     * warning so one hand-edit cannot block every later run.
     */
    public List<MemoryLogEntry> readAll() {
        String content;
        try {
            content = storagePort.getText(project, logFile).join();
        } catch (CompletionException e) {
            throw new MemoryStoreException(RunStage.DISTILLING, "Failed to read " + project + "/" + logFile, e);
        }
        if (content == null || content.isBlank()) {
            return Collections.emptyList();
        }

        List<MemoryLogEntry> entries = new ArrayList<>();
        String[] lines = content.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, MemoryLogEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Memory] Skipping malformed line {} in {}/{}: {}", i + 1, project, logFile,
                        e.getOriginalMessage());
            }
        }
        return Collections.unmodifiableList(entries);
    }

    public int count() {
        return readAll().size();
    }

    public ProjectMemory readMemory() {
        try {
            return ProjectMemory.of(storagePort.getText(project, memoryFile).join());
        } catch (CompletionException e) {
            throw new MemoryStoreException(RunStage.REDUCING, "Failed to read " + project + "/" + memoryFile, e);
        }
    }

    /**
     * Replace the memory document. The previous version is kept as a .bak
     * sibling until the next replace.
     */
    public void writeMemory(ProjectMemory memory) {
        try {
            storagePort.putTextAtomic(project, memoryFile, memory.getContent(), true).join();
            log.info("[Memory] Project memory replaced for {} ({} chars)", project, memory.getContent().length());
        } catch (CompletionException e) {
            throw new MemoryStoreException(RunStage.DISTILLING, "Failed to write " + project + "/" + memoryFile, e);
        }
    }
}
