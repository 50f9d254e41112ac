package me.golemcore.report.adapter.outbound.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.report.domain.exception.DeliveryException;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeishuNotifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private OkHttpMockEngine engine;
    private ReportProperties properties;
    private FeishuNotifier notifier;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new ReportProperties();
        properties.getFeishu().setEnabled(true);
        properties.getFeishu().setApiBaseUrl("https://feishu.test/open-apis");
        notifier = new FeishuNotifier(engine.client(), properties, objectMapper);
    }

    @Test
    void shouldSendTextAndFileInAppMode() throws Exception {
        configureApp();
        Path pdf = Files.writeString(tempDir.resolve("report.pdf"), "%PDF-1.4");
        engine.enqueueJson(200, "{\"code\":0,\"tenant_access_token\":\"t-123\"}");
        engine.enqueueJson(200, "{\"code\":0,\"data\":{\"file_key\":\"file_abc\"}}");
        engine.enqueueJson(200, "{\"code\":0}");
        engine.enqueueJson(200, "{\"code\":0}");

        DeliveryResult result = notifier.deliver(artifact(pdf), List.of("dev@acme.io"));

        assertTrue(result.isSuccessful());
        assertEquals(Boolean.TRUE, result.getRecipients().get("dev@acme.io"));
        assertEquals(4, engine.getRequestCount());

        OkHttpMockEngine.CapturedRequest token = engine.request(0);
        assertEquals("/open-apis/auth/v3/tenant_access_token/internal", token.target());
        assertEquals("cli_x", objectMapper.readTree(token.body()).path("app_id").asText());

        OkHttpMockEngine.CapturedRequest upload = engine.request(1);
        assertEquals("/open-apis/im/v1/files", upload.target());
        assertEquals("Bearer t-123", upload.header("Authorization"));
        assertTrue(upload.body().contains("report.pdf"));
        assertTrue(upload.body().contains("pdf"));

        OkHttpMockEngine.CapturedRequest text = engine.request(2);
        assertEquals("/open-apis/im/v1/messages?receive_id_type=email", text.target());
        JsonNode textBody = objectMapper.readTree(text.body());
        assertEquals("dev@acme.io", textBody.path("receive_id").asText());
        assertEquals("text", textBody.path("msg_type").asText());
        JsonNode content = objectMapper.readTree(textBody.path("content").asText());
        assertEquals("Git work report - demo - 2026-10-19\n\nShipped the cache.", content.path("text").asText());

        JsonNode fileBody = objectMapper.readTree(engine.request(3).body());
        assertEquals("file", fileBody.path("msg_type").asText());
        assertEquals("file_abc", objectMapper.readTree(fileBody.path("content").asText()).path("file_key").asText());
    }

    @Test
    void shouldFallBackToTextWhenUploadFails() throws Exception {
        configureApp();
        Path html = Files.writeString(tempDir.resolve("report.html"), "<html></html>");
        engine.enqueueJson(200, "{\"code\":0,\"tenant_access_token\":\"t-123\"}");
        engine.enqueueJson(200, "{\"code\":99991663,\"msg\":\"no permission\"}");
        engine.enqueueJson(200, "{\"code\":0}");

        DeliveryResult result = notifier.deliver(artifact(html), List.of("dev@acme.io"));

        assertTrue(result.isSuccessful());
        assertEquals(3, engine.getRequestCount());
        assertTrue(engine.request(1).body().contains("stream"));
    }

    @Test
    void shouldReportPerRecipientFailures() {
        configureApp();
        engine.enqueueJson(200, "{\"code\":0,\"tenant_access_token\":\"t-123\"}");
        engine.enqueueJson(200, "{\"code\":0}");
        engine.enqueueJson(200, "{\"code\":230001,\"msg\":\"user not found\"}");

        DeliveryResult result = notifier.deliver(artifact(null), List.of("a@acme.io", "ghost@acme.io"));

        assertTrue(result.isSuccessful());
        assertEquals(List.of("ghost@acme.io"), result.getFailedRecipients());
    }

    @Test
    void shouldFailWhenTokenIsRejected() {
        configureApp();
        engine.enqueueJson(200, "{\"code\":10003,\"msg\":\"invalid app_secret\"}");

        ReportArtifact artifact = artifact(null);
        List<String> recipients = List.of("dev@acme.io");
        DeliveryException e = assertThrows(DeliveryException.class, () -> notifier.deliver(artifact, recipients));
        assertTrue(e.getMessage().contains("invalid app_secret"));
    }

    @Test
    void shouldRequireRecipientsInAppMode() {
        configureApp();

        ReportArtifact artifact = artifact(null);
        assertThrows(DeliveryException.class, () -> notifier.deliver(artifact, List.of()));
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldPostTextToWebhook() throws Exception {
        properties.getFeishu().setWebhookUrl("https://feishu.test/hook/abc");
        engine.enqueueJson(200, "{\"StatusCode\":0,\"StatusMessage\":\"success\"}");

        DeliveryResult result = notifier.deliver(artifact(null), List.of());

        assertTrue(result.isSuccessful());
        assertEquals(List.of("webhook"), List.copyOf(result.getRecipients().keySet()));
        JsonNode body = objectMapper.readTree(engine.request(0).body());
        assertEquals("text", body.path("msg_type").asText());
        assertTrue(body.path("content").path("text").asText().startsWith("[Git work report - demo - 2026-10-19]"));
    }

    @Test
    void shouldFailWhenWebhookRejects() {
        properties.getFeishu().setWebhookUrl("https://feishu.test/hook/abc");
        engine.enqueueJson(200, "{\"code\":19001,\"msg\":\"param invalid\"}");

        ReportArtifact artifact = artifact(null);
        assertThrows(DeliveryException.class, () -> notifier.deliver(artifact, List.of()));
    }

    @Test
    void shouldFailWhenNothingConfigured() {
        ReportArtifact artifact = artifact(null);

        assertThrows(DeliveryException.class, () -> notifier.deliver(artifact, List.of("dev@acme.io")));
    }

    @Test
    void shouldTruncateLongSummaries() throws Exception {
        properties.getFeishu().setWebhookUrl("https://feishu.test/hook/abc");
        engine.enqueueJson(200, "{\"code\":0}");
        ReportArtifact artifact = artifact(null).toBuilder().summary("x".repeat(10_000)).build();

        notifier.deliver(artifact, List.of());

        String text = objectMapper.readTree(engine.request(0).body()).path("content").path("text").asText();
        assertEquals(4003, text.length());
        assertTrue(text.endsWith("..."));
    }

    private void configureApp() {
        properties.getFeishu().setAppId("cli_x");
        properties.getFeishu().setAppSecret("secret");
    }

    private static ReportArtifact artifact(Path attachment) {
        return ReportArtifact.builder()
                .subject("Git work report - demo - 2026-10-19")
                .summary("Shipped the cache.")
                .html("<html><body>report</body></html>")
                .htmlPath(attachment)
                .build();
    }
}
