package me.golemcore.report.adapter.outbound.llm;

import me.golemcore.report.domain.exception.UnknownProviderException;
import me.golemcore.report.domain.service.PromptTemplateEngine;
import me.golemcore.report.domain.service.PromptTemplateService;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmProviderRegistryTest {

    private ReportProperties properties;
    private ChatModelFactory chatModelFactory;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        chatModelFactory = mock(ChatModelFactory.class);
    }

    @Test
    void shouldRegisterBuiltInAndConfiguredProviders() {
        properties.getLlm().getProviders().put("deepseek", provider("sk-test", "deepseek-chat"));
        properties.getLlm().getProviders().put("gemini", provider(null, "gemini-2.5-flash"));

        LlmProviderRegistry registry = registry(List.of(new MockLlmAdapter()));

        assertEquals(List.of("mock", "deepseek", "gemini"), List.copyOf(registry.getProviderIds()));
        assertTrue(registry.isProviderAvailable("deepseek"));
        assertFalse(registry.isProviderAvailable("gemini"));
        assertFalse(registry.isProviderAvailable("absent"));
    }

    @Test
    void shouldResolveRegisteredProvider() {
        LlmProviderRegistry registry = registry(List.of(new MockLlmAdapter()));

        LlmPort port = registry.require("mock");

        assertEquals("mock", port.getProviderId());
        verifyNoInteractions(chatModelFactory);
    }

    @Test
    void shouldRejectUnknownProviderNamingTheRegisteredOnes() {
        LlmProviderRegistry registry = registry(List.of(new MockLlmAdapter()));

        UnknownProviderException e = assertThrows(UnknownProviderException.class, () -> registry.require("foo"));

        assertEquals("foo", e.getProviderId());
        assertTrue(e.getMessage().contains("mock"));
        assertThrows(UnknownProviderException.class, () -> registry.require(null));
    }

    @Test
    void shouldRejectDuplicateProviderIds() {
        properties.getLlm().getProviders().put("mock", provider("key", "model"));

        assertThrows(IllegalStateException.class, () -> registry(List.of(new MockLlmAdapter())));
    }

    private LlmProviderRegistry registry(List<LlmProviderAdapter> adapters) {
        LlmProviderRegistry registry = new LlmProviderRegistry(properties, adapters, chatModelFactory,
                new PromptTemplateService(), new PromptTemplateEngine());
        registry.init();
        return registry;
    }

    private static ReportProperties.ProviderProperties provider(String apiKey, String model) {
        ReportProperties.ProviderProperties config = new ReportProperties.ProviderProperties();
        config.setApiKey(apiKey);
        config.setModel(model);
        return config;
    }
}
