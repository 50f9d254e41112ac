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

package me.golemcore.report.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.ArticlePrompt;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.model.DistillPrompt;
import me.golemcore.report.domain.model.MemoryLogEntry;
import me.golemcore.report.domain.model.ReducePrompt;
import me.golemcore.report.domain.service.PromptVariables;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Deterministic offline provider. Produces stable text from its inputs without
 * any network access, for dry runs and tests.
 */
@Component
@Slf4j
public class MockLlmAdapter implements LlmProviderAdapter {

    public static final String PROVIDER_ID = "mock";
    private static final int MEMORY_HIGHLIGHTS = 5;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String summarizeDiff(DiffPrompt prompt) {
        long lines = prompt.getDiffText() == null ? 0 : prompt.getDiffText().lines().count();
        return "[Mock] " + prompt.getCommit().getMessage() + " (" + lines + " diff lines)";
    }

    @Override
    public String reduceSummaries(ReducePrompt prompt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# [Mock] Daily summary: ").append(prompt.getProjectName()).append("\n\n");
        sb.append(PromptVariables.formatSummaries(prompt.getDiffSummaries())).append("\n\n");
        sb.append("Changes: +").append(prompt.getStats().getAdditions())
                .append(" -").append(prompt.getStats().getDeletions())
                .append(" across ").append(prompt.getStats().getFilesChanged()).append(" files.");
        if (prompt.getPriorMemory() != null && !prompt.getPriorMemory().isBlank()) {
            sb.append("\n\nContinues from existing project memory.");
        }
        return sb.toString();
    }

    /**
     * Ranks entries by position (recency) times magnitude and lists the top few,
     * most recent first on ties.
     */
    @Override
    public String distillMemory(DistillPrompt prompt) {
        List<MemoryLogEntry> entries = prompt.getEntries();
        int size = entries.size();
        List<Integer> ranked = IntStream.range(0, size).boxed()
                .sorted(Comparator.<Integer>comparingLong(i -> weight(entries.get(i), i)).reversed()
                        .thenComparing(Comparator.<Integer>reverseOrder()))
                .limit(MEMORY_HIGHLIGHTS)
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("# [Mock] Project memory: ").append(prompt.getProjectName()).append("\n\n");
        sb.append("Distilled from ").append(size).append(" entries.\n");
        for (int index : ranked) {
            MemoryLogEntry entry = entries.get(index);
            sb.append("\n- ").append(entry.getDate()).append(" (magnitude ").append(entry.getChangeMagnitude())
                    .append("): ").append(firstLine(entry.getSummary()));
        }
        return sb.toString();
    }

    @Override
    public String generateStyledArticle(ArticlePrompt prompt) {
        return "# [Mock] " + prompt.getStyle() + " article: " + prompt.getProjectName() + "\n\n"
                + prompt.getDailySummary();
    }

    private static long weight(MemoryLogEntry entry, int index) {
        long recency = index + 1L;
        long magnitude = 1L + Math.max(0, entry.getChangeMagnitude());
        return recency * magnitude;
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        return text.lines().filter(line -> !line.isBlank()).findFirst().orElse("").strip();
    }
}
