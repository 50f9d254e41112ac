package me.golemcore.report.port.outbound;

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

import me.golemcore.report.domain.model.ArticlePrompt;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.model.DistillPrompt;
import me.golemcore.report.domain.model.ReducePrompt;

/**
 * Port for language-model providers. Each operation takes a structured prompt
 * context and returns plain text; prompt templates are resolved by the
 * provider from (provider, style, stage).
 *
 * <p>
 * Calls block up to the provider's request timeout and throw
 * {@link me.golemcore.report.domain.exception.LlmProviderException} on API
 * errors, timeouts and empty answers.
 */
public interface LlmPort {

    /**
     * Registry name of this provider (e.g. "deepseek", "gemini", "mock").
     */
    String getProviderId();

    /**
     * Whether the provider has what it needs to make calls (API key, endpoint).
     */
    boolean isAvailable();

    /**
     * Summarize one commit's diff in a sentence or short paragraph.
     */
    String summarizeDiff(DiffPrompt prompt);

    /**
     * Combine Map outputs, statistics and prior memory into the daily summary.
     */
    String reduceSummaries(ReducePrompt prompt);

    /**
     * Compress the full project log into a memory document.
     */
    String distillMemory(DistillPrompt prompt);

    /**
     * Write the daily summary as prose in the requested style.
     */
    String generateStyledArticle(ArticlePrompt prompt);
}
