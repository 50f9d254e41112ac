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

package me.golemcore.report.adapter.outbound.notify.mail;

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import me.golemcore.report.infrastructure.config.ReportProperties;

import java.util.Properties;

/**
 * Builds the authenticated Jakarta Mail session for report delivery from
 * {@code report.mail.*}.
 */
public final class MailSessionFactory {

    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    public static Session createSmtpSession(ReportProperties.MailProperties mail) {
        MailSecurity security = MailSecurity.fromString(mail.getSecurity());
        String protocol = security == MailSecurity.SSL ? "smtps" : "smtp";
        String prefix = "mail." + protocol + ".";

        Properties props = new Properties();
        props.put("mail.transport.protocol", protocol);
        props.put(prefix + "host", mail.getHost());
        props.put(prefix + "port", String.valueOf(security.resolvePort(mail.getPort())));
        props.put(prefix + "auth", TRUE_VALUE);
        props.put(prefix + "connectiontimeout", String.valueOf(mail.getConnectTimeout()));
        props.put(prefix + "timeout", String.valueOf(mail.getReadTimeout()));
        props.put(prefix + "writetimeout", String.valueOf(mail.getReadTimeout()));
        if (security == MailSecurity.SSL) {
            props.put(prefix + "ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(prefix + "starttls.enable", TRUE_VALUE);
            props.put(prefix + "starttls.required", TRUE_VALUE);
        }

        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(mail.getUsername(), mail.getPassword());
            }
        });
    }
}
