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

import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.model.ArticlePrompt;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.model.DistillPrompt;
import me.golemcore.report.domain.model.PromptStage;
import me.golemcore.report.domain.model.PromptTemplate;
import me.golemcore.report.domain.model.ReducePrompt;
import me.golemcore.report.domain.service.LlmErrorClassifier;
import me.golemcore.report.domain.service.PromptTemplateEngine;
import me.golemcore.report.domain.service.PromptTemplateService;
import me.golemcore.report.domain.service.PromptVariables;

import java.util.Map;

/**
 * Base for adapters that answer every operation with one chat completion over
 * a (provider, style, stage) prompt template.
 */
public abstract class TemplatedLlmAdapter implements LlmProviderAdapter {

    private final PromptTemplateService templateService;
    private final PromptTemplateEngine templateEngine;

    protected TemplatedLlmAdapter(PromptTemplateService templateService, PromptTemplateEngine templateEngine) {
        this.templateService = templateService;
        this.templateEngine = templateEngine;
    }

    /**
     * Run one completion. Implementations throw {@link LlmProviderException} on
     * any failure.
     */
    protected abstract String complete(String systemPrompt, String userPrompt);

    @Override
    public String summarizeDiff(DiffPrompt prompt) {
        String text = call(prompt.getStyle(), PromptStage.DIFF_MAP, PromptVariables.forDiff(prompt));
        return text.strip().replace("\n", " ");
    }

    @Override
    public String reduceSummaries(ReducePrompt prompt) {
        return call(prompt.getStyle(), PromptStage.SUMMARY_REDUCE, PromptVariables.forReduce(prompt));
    }

    @Override
    public String distillMemory(DistillPrompt prompt) {
        return call(null, PromptStage.MEMORY_DISTILL, PromptVariables.forDistill(prompt));
    }

    @Override
    public String generateStyledArticle(ArticlePrompt prompt) {
        return call(prompt.getStyle(), PromptStage.ARTICLE, PromptVariables.forArticle(prompt));
    }

    private String call(String style, PromptStage stage, Map<String, String> variables) {
        PromptTemplate template = templateService.resolve(getProviderId(), style, stage);
        PromptTemplateEngine.RenderedPrompt rendered = templateEngine.renderPrompt(template, variables);
        String answer = complete(rendered.system(), rendered.user());
        if (answer == null || answer.isBlank()) {
            throw new LlmProviderException(getProviderId(), LlmErrorClassifier.EMPTY_RESPONSE,
                    "Empty answer for stage " + stage.getKey());
        }
        return answer.strip();
    }
}
