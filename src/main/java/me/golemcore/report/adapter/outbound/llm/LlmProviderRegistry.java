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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.UnknownProviderException;
import me.golemcore.report.domain.service.PromptTemplateEngine;
import me.golemcore.report.domain.service.PromptTemplateService;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.LlmPort;
import me.golemcore.report.port.outbound.LlmRegistryPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static table of LLM providers, populated once at startup.
 *
 * <p>
 * Entries come from two places:
 * <ul>
 * <li>provider adapter beans (e.g. {@code mock})</li>
 * <li>{@code report.llm.providers.<name>} entries, each backed by a
 * {@link Langchain4jProviderAdapter}</li>
 * </ul>
 * Lookup never falls back: an unregistered name fails with
 * {@link UnknownProviderException} before any provider is contacted.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmProviderRegistry implements LlmRegistryPort {

    private final ReportProperties properties;
    private final List<LlmProviderAdapter> adapters;
    private final ChatModelFactory chatModelFactory;
    private final PromptTemplateService templateService;
    private final PromptTemplateEngine templateEngine;

    private Map<String, LlmProviderAdapter> adaptersByProvider = Collections.emptyMap();

    @PostConstruct
    public void init() {
        Map<String, LlmProviderAdapter> table = new LinkedHashMap<>();
        for (LlmProviderAdapter adapter : adapters) {
            register(table, adapter);
        }

        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        properties.getLlm().getProviders().forEach((name, config) -> register(table,
                new Langchain4jProviderAdapter(name, config, timeout, chatModelFactory, templateService,
                        templateEngine)));

        this.adaptersByProvider = Collections.unmodifiableMap(table);
        log.info("[LLM] Registered providers: {}", adaptersByProvider.keySet());
    }

    private void register(Map<String, LlmProviderAdapter> table, LlmProviderAdapter adapter) {
        String id = adapter.getProviderId();
        if (table.containsKey(id)) {
            throw new IllegalStateException("Duplicate LLM provider id: " + id);
        }
        table.put(id, adapter);
        log.debug("[LLM] Registered provider: {} (available: {})", id, adapter.isAvailable());
    }

    @Override
    public LlmPort require(String providerId) {
        LlmProviderAdapter adapter = providerId != null ? adaptersByProvider.get(providerId) : null;
        if (adapter == null) {
            throw new UnknownProviderException(providerId, adaptersByProvider.keySet());
        }
        return adapter;
    }

    @Override
    public Set<String> getProviderIds() {
        return adaptersByProvider.keySet();
    }

    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }
}
