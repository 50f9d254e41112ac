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

package me.golemcore.report.adapter.outbound.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.DeliveryException;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.NotifierPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Delivers reports to Feishu (Lark).
 *
 * <p>
 * With app credentials the notifier obtains a tenant token, uploads the
 * attachment once and messages each recipient by email address. Without them
 * it posts the summary text to the group webhook, which reaches everyone in
 * the group at once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeishuNotifier implements NotifierPort {

    private static final String CHANNEL = "feishu";
    private static final String WEBHOOK_RECIPIENT = "webhook";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_TEXT_LENGTH = 4000;

    private final OkHttpClient okHttpClient;
    private final ReportProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public boolean isEnabled() {
        return properties.getFeishu().isEnabled();
    }

    @Override
    public DeliveryResult deliver(ReportArtifact artifact, List<String> recipients) {
        ReportProperties.FeishuProperties feishu = properties.getFeishu();
        if (hasText(feishu.getAppId()) && hasText(feishu.getAppSecret())) {
            return deliverViaApp(artifact, recipients);
        }
        if (hasText(feishu.getWebhookUrl())) {
            return deliverViaWebhook(artifact, recipients);
        }
        throw new DeliveryException("Feishu has neither app credentials nor a webhook configured");
    }

    private DeliveryResult deliverViaApp(ReportArtifact artifact, List<String> recipients) {
        if (recipients.isEmpty()) {
            throw new DeliveryException("Feishu app mode needs at least one recipient email");
        }
        String token = fetchTenantToken();
        String fileKey = null;
        Path attachment = artifact.getAttachment();
        if (attachment != null && Files.isRegularFile(attachment)) {
            try {
                fileKey = uploadFile(token, attachment);
            } catch (DeliveryException e) {
                log.warn("[Feishu] Attachment upload failed, sending text only: {}", e.getMessage());
            }
        }

        String text = truncate(artifact.getSubject() + "\n\n" + artifact.getSummary());
        Map<String, Boolean> outcome = new LinkedHashMap<>();
        for (String email : recipients) {
            boolean sent = sendMessage(token, email, "text", Map.of("text", text));
            if (sent && fileKey != null && !sendMessage(token, email, "file", Map.of("file_key", fileKey))) {
                log.warn("[Feishu] Summary reached {} but the attachment did not", email);
            }
            outcome.put(email, sent);
        }
        log.info("[Feishu] Delivered to {}/{} recipients", outcome.values().stream().filter(b -> b).count(),
                recipients.size());
        return DeliveryResult.builder().channel(CHANNEL).recipients(outcome).build();
    }

    private DeliveryResult deliverViaWebhook(ReportArtifact artifact, List<String> recipients) {
        log.info("[Feishu] Using webhook mode (text only)");
        Map<String, Object> payload = Map.of(
                "msg_type", "text",
                "content", Map.of("text", truncate("[" + artifact.getSubject() + "]\n\n" + artifact.getSummary())));
        HttpUrl url = HttpUrl.parse(properties.getFeishu().getWebhookUrl());
        if (url == null) {
            throw new DeliveryException("Invalid Feishu webhook url");
        }
        JsonNode response = post(new Request.Builder().url(url), payload);
        boolean ok = response.path("code").asInt(-1) == 0 || response.path("StatusCode").asInt(-1) == 0;
        if (!ok) {
            throw new DeliveryException("Feishu webhook rejected the message: " + response.path("msg").asText());
        }
        Map<String, Boolean> outcome = new LinkedHashMap<>();
        if (recipients.isEmpty()) {
            outcome.put(WEBHOOK_RECIPIENT, true);
        } else {
            recipients.forEach(r -> outcome.put(r, true));
        }
        return DeliveryResult.builder().channel(CHANNEL).recipients(outcome).build();
    }

    private String fetchTenantToken() {
        ReportProperties.FeishuProperties feishu = properties.getFeishu();
        JsonNode response = post(new Request.Builder().url(api("auth/v3/tenant_access_token/internal")),
                Map.of("app_id", feishu.getAppId(), "app_secret", feishu.getAppSecret()));
        if (response.path("code").asInt(-1) != 0) {
            throw new DeliveryException("Feishu token request failed: " + response.path("msg").asText());
        }
        return response.path("tenant_access_token").asText();
    }

    private String uploadFile(String token, Path file) {
        String fileName = file.getFileName().toString();
        String fileType = fileName.toLowerCase(Locale.ROOT).endsWith(".pdf") ? "pdf" : "stream";
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file_type", fileType)
                .addFormDataPart("file_name", fileName)
                .addFormDataPart("file", fileName,
                        RequestBody.create(file.toFile(), MediaType.parse("application/octet-stream")))
                .build();
        Request request = new Request.Builder()
                .url(api("im/v1/files"))
                .header("Authorization", "Bearer " + token)
                .post(body)
                .build();
        JsonNode response = execute(request);
        if (response.path("code").asInt(-1) != 0) {
            throw new DeliveryException("Feishu upload failed: " + response.path("msg").asText());
        }
        return response.path("data").path("file_key").asText();
    }

    private boolean sendMessage(String token, String email, String msgType, Map<String, String> content) {
        try {
            Map<String, Object> payload = Map.of(
                    "receive_id", email,
                    "msg_type", msgType,
                    "content", objectMapper.writeValueAsString(content));
            HttpUrl url = api("im/v1/messages").newBuilder()
                    .addQueryParameter("receive_id_type", "email")
                    .build();
            JsonNode response = post(new Request.Builder().url(url).header("Authorization", "Bearer " + token),
                    payload);
            if (response.path("code").asInt(-1) != 0) {
                log.warn("[Feishu] Message to {} rejected: {}", email, response.path("msg").asText());
                return false;
            }
            return true;
        } catch (IOException | DeliveryException e) {
            log.warn("[Feishu] Message to {} failed: {}", email, e.getMessage());
            return false;
        }
    }

    private JsonNode post(Request.Builder builder, Map<String, ?> payload) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            return execute(builder.post(RequestBody.create(json, JSON)).build());
        } catch (IOException e) {
            throw new DeliveryException("Failed to encode Feishu request: " + e.getMessage(), e);
        }
    }

    private JsonNode execute(Request request) {
        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful() && text.isBlank()) {
                throw new DeliveryException("Feishu request failed with HTTP " + response.code());
            }
            return objectMapper.readTree(text.isBlank() ? "{}" : text);
        } catch (IOException e) {
            throw new DeliveryException("Feishu request failed: " + e.getMessage(), e);
        }
    }

    private HttpUrl api(String path) {
        HttpUrl base = HttpUrl.parse(properties.getFeishu().getApiBaseUrl());
        if (base == null) {
            throw new DeliveryException("Invalid Feishu API base url: " + properties.getFeishu().getApiBaseUrl());
        }
        return base.newBuilder().addPathSegments(path).build();
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) + "..." : text;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
