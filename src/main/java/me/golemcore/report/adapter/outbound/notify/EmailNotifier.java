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

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.adapter.outbound.notify.mail.MailSessionFactory;
import me.golemcore.report.domain.exception.DeliveryException;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.NotifierPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sends the rendered report over SMTP, one message per recipient, with the HTML
 * report as the body and the exported document attached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // MimeMessage.setSentDate requires java.util.Date
public class EmailNotifier implements NotifierPort {

    private static final String CHANNEL = "email";
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final ReportProperties properties;

    @Override
    public String getChannel() {
        return CHANNEL;
    }

    @Override
    public boolean isEnabled() {
        return properties.getMail().isEnabled();
    }

    @Override
    public DeliveryResult deliver(ReportArtifact artifact, List<String> recipients) {
        ReportProperties.MailProperties mail = properties.getMail();
        requireConfigured(mail);
        Session session = MailSessionFactory.createSmtpSession(mail);
        String from = mail.getFrom() != null && !mail.getFrom().isBlank() ? mail.getFrom() : mail.getUsername();

        Map<String, Boolean> outcome = new LinkedHashMap<>();
        for (String recipient : recipients) {
            String address = recipient.trim();
            if (!EMAIL_PATTERN.matcher(address).matches()) {
                log.warn("[Email] Skipping invalid address: {}", address);
                outcome.put(recipient, false);
                continue;
            }
            try {
                deliver(buildMessage(session, from, address, artifact));
                log.info("[Email] Report sent to {}", address);
                outcome.put(recipient, true);
            } catch (MessagingException | IOException e) {
                log.warn("[Email] Failed to send to {}: {}", address, sanitizeError(e.getMessage()));
                outcome.put(recipient, false);
            }
        }
        return DeliveryResult.builder().channel(CHANNEL).recipients(outcome).build();
    }

    MimeMessage buildMessage(Session session, String from, String to, ReportArtifact artifact)
            throws MessagingException, IOException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(artifact.getSubject(), "UTF-8");

        MimeMultipart multipart = new MimeMultipart("mixed");
        MimeBodyPart body = new MimeBodyPart();
        body.setContent(artifact.getHtml(), "text/html; charset=UTF-8");
        multipart.addBodyPart(body);

        Path attachment = artifact.getAttachment();
        if (attachment != null && Files.isRegularFile(attachment)) {
            MimeBodyPart file = new MimeBodyPart();
            file.attachFile(attachment.toFile());
            file.setFileName(attachment.getFileName().toString());
            multipart.addBodyPart(file);
        }
        message.setContent(multipart);
        message.setSentDate(new Date());
        return message;
    }

    private void requireConfigured(ReportProperties.MailProperties mail) {
        if (isBlank(mail.getHost())) {
            throw new DeliveryException("SMTP host is not configured");
        }
        if (isBlank(mail.getUsername()) || isBlank(mail.getPassword())) {
            throw new DeliveryException("SMTP credentials are not configured");
        }
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        ReportProperties.MailProperties mail = properties.getMail();
        String sanitized = message;
        if (!isBlank(mail.getUsername())) {
            sanitized = sanitized.replace(mail.getUsername(), "***");
        }
        if (!isBlank(mail.getPassword())) {
            sanitized = sanitized.replace(mail.getPassword(), "***");
        }
        return sanitized;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }
}
