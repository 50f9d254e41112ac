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

import java.util.Locale;

/**
 * SMTP connection security modes and their standard ports.
 */
public enum MailSecurity {

    SSL(465), STARTTLS(587), NONE(25);

    private final int defaultPort;

    MailSecurity(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Configured port, or the mode's standard port when none is set.
     */
    public int resolvePort(int configured) {
        return configured > 0 ? configured : defaultPort;
    }

    /**
     * Case-insensitive; blank means {@link #SSL}.
     *
     * @throws IllegalArgumentException
     *             for an unknown mode
     */
    public static MailSecurity fromString(String value) {
        if (value == null || value.isBlank()) {
            return SSL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
