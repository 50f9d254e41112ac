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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.DistillationFailedException;
import me.golemcore.report.domain.model.DistillPrompt;
import me.golemcore.report.domain.model.MemoryLogEntry;
import me.golemcore.report.domain.model.ProjectMemory;
import me.golemcore.report.domain.model.RunContext;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compresses a project's full log into its memory document.
 *
 * <p>
 * Policy: distill on demand, whenever no memory exists yet, and every N-th
 * logged run ({@code report.memory.distill-every-runs}, 0 disables the
 * cadence). The result is a function of the log alone, and the memory
 * document is replaced, never merged.
 */
@Service
@Slf4j
public class MemoryDistillationService {

    public boolean isDue(RunContext context, int entryCount, ProjectMemory current) {
        if (entryCount == 0) {
            return false;
        }
        if (context.isForceDistill() || current.isEmpty()) {
            return true;
        }
        int every = context.getSettings().getDistillEveryRuns();
        return every > 0 && entryCount % every == 0;
    }

    /**
     * Distill from the full log and replace the memory document.
     *
     * @throws DistillationFailedException
     *             when the log cannot be read, the provider fails, or the
     *             document cannot be written; the previous memory stays in
     *             place
     */
    public ProjectMemory distill(RunContext context) {
        MemoryStore store = context.getMemoryStore();
        try {
            List<MemoryLogEntry> entries = store.readAll();
            if (entries.isEmpty()) {
                throw new DistillationFailedException("Project log is empty", null);
            }
            log.info("[Memory] Distilling {} log entries for {} with '{}'", entries.size(), store.getProject(),
                    context.getProviderId());
            String text = context.getLlm().distillMemory(DistillPrompt.builder()
                    .projectName(context.getProjectName())
                    .entries(entries)
                    .build());
            if (text == null || text.isBlank()) {
                throw new DistillationFailedException("Provider returned an empty memory document", null);
            }
            ProjectMemory memory = ProjectMemory.of(text.strip());
            store.writeMemory(memory);
            return memory;
        } catch (DistillationFailedException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR - provider and store failures alike
            throw new DistillationFailedException("Distillation failed: " + e.getMessage(), e);
        }
    }
}
