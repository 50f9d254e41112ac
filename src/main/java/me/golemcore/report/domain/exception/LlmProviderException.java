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

package me.golemcore.report.domain.exception;

import me.golemcore.report.domain.service.LlmErrorClassifier;

/**
 * A provider call failed. Carries a machine-readable code from
 * {@link LlmErrorClassifier} so callers can decide whether to retry.
 */
public class LlmProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String providerId;
    private final String code;

    public LlmProviderException(String providerId, String code, String message) {
        super(LlmErrorClassifier.withCode(code, message));
        this.providerId = providerId;
        this.code = code;
    }

    public LlmProviderException(String providerId, String code, String message, Throwable cause) {
        super(LlmErrorClassifier.withCode(code, message), cause);
        this.providerId = providerId;
        this.code = code;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getCode() {
        return code;
    }

    public boolean isTransient() {
        return LlmErrorClassifier.isTransientCode(code);
    }
}
