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

import me.golemcore.report.domain.model.ArticlePrompt;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.model.DiffSummary;
import me.golemcore.report.domain.model.DistillPrompt;
import me.golemcore.report.domain.model.MemoryLogEntry;
import me.golemcore.report.domain.model.ReducePrompt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template variables for each prompt stage. Templates reference these names as
 * {@code {{NAME}}}.
 */
public final class PromptVariables {

    public static final String STYLE = "STYLE";
    public static final String PROJECT = "PROJECT";
    public static final String COMMIT_ID = "COMMIT_ID";
    public static final String AUTHOR = "AUTHOR";
    public static final String MESSAGE = "MESSAGE";
    public static final String DIFF = "DIFF";
    public static final String WINDOW = "WINDOW";
    public static final String DIFF_SUMMARIES = "DIFF_SUMMARIES";
    public static final String STATS = "STATS";
    public static final String COMMIT_COUNT = "COMMIT_COUNT";
    public static final String PRIOR_MEMORY = "PRIOR_MEMORY";
    public static final String ENTRY_COUNT = "ENTRY_COUNT";
    public static final String LOG = "LOG";
    public static final String SUMMARY = "SUMMARY";
    public static final String MEMORY = "MEMORY";
    public static final String README = "README";

    static final String NO_MEMORY = "(no prior project memory)";
    static final String NO_README = "(no README available)";
    private static final int MAX_README_CHARS = 6000;

    private PromptVariables() {
    }

    public static Map<String, String> forDiff(DiffPrompt prompt) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put(STYLE, prompt.getStyle());
        vars.put(COMMIT_ID, prompt.getCommit().getShortId());
        vars.put(AUTHOR, prompt.getCommit().getAuthor());
        vars.put(MESSAGE, prompt.getCommit().getMessage());
        vars.put(DIFF, prompt.getDiffText());
        return vars;
    }

    public static Map<String, String> forReduce(ReducePrompt prompt) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put(STYLE, prompt.getStyle());
        vars.put(PROJECT, prompt.getProjectName());
        vars.put(WINDOW, prompt.getWindow());
        vars.put(DIFF_SUMMARIES, formatSummaries(prompt.getDiffSummaries()));
        vars.put(STATS, prompt.getStatsReport());
        vars.put(COMMIT_COUNT, String.valueOf(prompt.getDiffSummaries().size()));
        vars.put(PRIOR_MEMORY, orDefault(prompt.getPriorMemory(), NO_MEMORY));
        return vars;
    }

    public static Map<String, String> forDistill(DistillPrompt prompt) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put(PROJECT, prompt.getProjectName());
        vars.put(ENTRY_COUNT, String.valueOf(prompt.getEntries().size()));
        vars.put(LOG, formatLog(prompt.getEntries()));
        return vars;
    }

    public static Map<String, String> forArticle(ArticlePrompt prompt) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put(STYLE, prompt.getStyle());
        vars.put(PROJECT, prompt.getProjectName());
        vars.put(SUMMARY, prompt.getDailySummary());
        vars.put(MEMORY, orDefault(prompt.getProjectMemory(), NO_MEMORY));
        vars.put(README, truncate(orDefault(prompt.getReadme(), NO_README), MAX_README_CHARS));
        return vars;
    }

    /**
     * Numbered list in chronological order: {@code 1. [abc1234] alice: text}.
     */
    public static String formatSummaries(List<DiffSummary> summaries) {
        if (summaries.isEmpty()) {
            return "(no commit summaries)";
        }
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (DiffSummary summary : summaries) {
            sb.append(n++).append(". [").append(summary.getCommitId()).append("] ")
                    .append(summary.getAuthor()).append(": ").append(summary.getText()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Oldest-first log listing with position and magnitude, the inputs for
     * recency and magnitude weighting.
     */
    public static String formatLog(List<MemoryLogEntry> entries) {
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (MemoryLogEntry entry : entries) {
            sb.append("### Entry ").append(n++).append(" of ").append(entries.size())
                    .append(" | ").append(entry.getDate())
                    .append(" | +").append(entry.getAdditions())
                    .append(" -").append(entry.getDeletions())
                    .append(" | magnitude ").append(entry.getChangeMagnitude())
                    .append('\n').append(entry.getSummary()).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "\n...";
    }
}
