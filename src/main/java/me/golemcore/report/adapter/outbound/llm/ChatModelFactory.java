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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds langchain4j chat models from {@code report.llm.providers.<name>}
 * entries. OpenAI-compatible endpoints (DeepSeek, Ollama) use the
 * {@code openai} type with a custom base URL.
 */
@Component
public class ChatModelFactory {

    static final String TYPE_OPENAI = "openai";
    static final String TYPE_ANTHROPIC = "anthropic";
    static final String TYPE_GEMINI = "gemini";

    public ChatModel create(ReportProperties.ProviderProperties config, Duration timeout) {
        String type = config.getType() != null ? config.getType().toLowerCase(Locale.ROOT) : TYPE_OPENAI;
        return switch (type) {
        case TYPE_ANTHROPIC -> createAnthropicModel(config, timeout);
        case TYPE_GEMINI -> createGeminiModel(config, timeout);
        case TYPE_OPENAI -> createOpenAiModel(config, timeout);
        default -> throw new IllegalArgumentException("Unsupported provider type: " + config.getType());
        };
    }

    private ChatModel createAnthropicModel(ReportProperties.ProviderProperties config, Duration timeout) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by the pipeline
                .maxTokens(4096)
                .timeout(timeout);

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(ReportProperties.ProviderProperties config, Duration timeout) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by the pipeline
                .timeout(timeout);

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createGeminiModel(ReportProperties.ProviderProperties config, Duration timeout) {
        var builder = GoogleAiGeminiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(timeout);

        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }
}
