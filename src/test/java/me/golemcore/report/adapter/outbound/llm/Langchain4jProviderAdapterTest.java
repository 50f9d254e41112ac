package me.golemcore.report.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.service.LlmErrorClassifier;
import me.golemcore.report.domain.service.PromptTemplateEngine;
import me.golemcore.report.domain.service.PromptTemplateService;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jProviderAdapterTest {

    private ChatModelFactory chatModelFactory;
    private ChatModel chatModel;
    private ReportProperties.ProviderProperties config;

    @BeforeEach
    void setUp() {
        chatModelFactory = mock(ChatModelFactory.class);
        chatModel = mock(ChatModel.class);
        config = new ReportProperties.ProviderProperties();
        config.setApiKey("sk-test");
        config.setModel("deepseek-chat");
        when(chatModelFactory.create(any(), any())).thenReturn(chatModel);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRenderTemplateIntoSystemAndUserMessages() {
        when(chatModel.chat(anyList())).thenReturn(response("Adds retry\nto the client."));

        String summary = adapter().summarizeDiff(diffPrompt());

        assertEquals("Adds retry to the client.", summary);
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertEquals(2, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        UserMessage user = (UserMessage) messages.get(1);
        assertTrue(user.singleText().contains("Commit abc1234 by carol"));
        assertTrue(user.singleText().contains("+retry()"));
    }

    @Test
    void shouldCreateModelOnlyOnce() {
        when(chatModel.chat(anyList())).thenReturn(response("ok"));
        Langchain4jProviderAdapter adapter = adapter();

        adapter.summarizeDiff(diffPrompt());
        adapter.summarizeDiff(diffPrompt());

        verify(chatModelFactory, times(1)).create(any(), any());
    }

    @Test
    void shouldRejectCallsWhenNotConfigured() {
        config.setApiKey(" ");
        Langchain4jProviderAdapter adapter = adapter();

        assertFalse(adapter.isAvailable());
        LlmProviderException e = assertThrows(LlmProviderException.class, adapter::initialize);
        assertEquals(LlmErrorClassifier.PROVIDER_NOT_CONFIGURED, e.getCode());
        verifyNoInteractions(chatModelFactory);
    }

    @Test
    void shouldClassifyProviderFailures() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("429 Too Many Requests"));

        LlmProviderException e = assertThrows(LlmProviderException.class,
                () -> adapter().summarizeDiff(diffPrompt()));

        assertEquals(LlmErrorClassifier.RATE_LIMIT, e.getCode());
        assertTrue(e.isTransient());
        assertEquals("deepseek", e.getProviderId());
    }

    @Test
    void shouldTreatBlankAnswerAsEmptyResponse() {
        when(chatModel.chat(anyList())).thenReturn(response("  "));

        LlmProviderException e = assertThrows(LlmProviderException.class,
                () -> adapter().summarizeDiff(diffPrompt()));

        assertEquals(LlmErrorClassifier.EMPTY_RESPONSE, e.getCode());
        assertFalse(e.isTransient());
    }

    private Langchain4jProviderAdapter adapter() {
        return new Langchain4jProviderAdapter("deepseek", config, Duration.ofSeconds(5), chatModelFactory,
                new PromptTemplateService(), new PromptTemplateEngine());
    }

    private static DiffPrompt diffPrompt() {
        return DiffPrompt.builder()
                .style("default")
                .commit(Commit.builder().id("abc1234def").author("carol").message("add retry").build())
                .diffText("diff --git a/Client.java b/Client.java\n+retry()")
                .build();
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
