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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.service.LlmErrorClassifier;
import me.golemcore.report.domain.service.PromptTemplateEngine;
import me.golemcore.report.domain.service.PromptTemplateService;
import me.golemcore.report.infrastructure.config.ReportProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM provider backed by a langchain4j {@link ChatModel}. One instance exists
 * per configured provider entry; the model is built on first use.
 *
 * <p>
 * Calls are single-shot: the model's own retries are disabled and the
 * pipeline decides what to retry.
 */
@Slf4j
public class Langchain4jProviderAdapter extends TemplatedLlmAdapter {

    private final String providerId;
    private final ReportProperties.ProviderProperties config;
    private final Duration timeout;
    private final ChatModelFactory chatModelFactory;

    private volatile ChatModel chatModel;

    public Langchain4jProviderAdapter(String providerId, ReportProperties.ProviderProperties config,
            Duration timeout, ChatModelFactory chatModelFactory, PromptTemplateService templateService,
            PromptTemplateEngine templateEngine) {
        super(templateService, templateEngine);
        this.providerId = providerId;
        this.config = config;
        this.timeout = timeout;
        this.chatModelFactory = chatModelFactory;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank()
                && config.getModel() != null && !config.getModel().isBlank();
    }

    @Override
    public synchronized void initialize() {
        if (chatModel != null) {
            return;
        }
        if (!isAvailable()) {
            throw new LlmProviderException(providerId, LlmErrorClassifier.PROVIDER_NOT_CONFIGURED,
                    "Provider '" + providerId + "' needs report.llm.providers." + providerId
                            + ".api-key and .model");
        }
        this.chatModel = chatModelFactory.create(config, timeout);
        log.info("[LLM] Provider '{}' initialized (type: {}, model: {})", providerId, config.getType(),
                config.getModel());
    }

    @Override
    protected String complete(String systemPrompt, String userPrompt) {
        if (chatModel == null) {
            initialize();
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(userPrompt));

        try {
            ChatResponse response = chatModel.chat(messages);
            if (response == null || response.aiMessage() == null) {
                return null;
            }
            return response.aiMessage().text();
        } catch (RuntimeException e) {
            String code = LlmErrorClassifier.classifyFromThrowable(e);
            log.debug("[LLM] Provider '{}' call failed ({}): {}", providerId, code, e.getMessage());
            throw new LlmProviderException(providerId, code, e.getMessage(), e);
        }
    }
}
