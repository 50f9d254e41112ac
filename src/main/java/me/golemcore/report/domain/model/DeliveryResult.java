package me.golemcore.report.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-recipient outcome of one notifier.
 */
@Value
@Builder
public class DeliveryResult {

    String channel;

    /** Recipient to delivered flag, in recipient order. */
    @Singular
    Map<String, Boolean> recipients;

    /** Channel-level error, null when the channel attempted delivery. */
    String error;

    public boolean isSuccessful() {
        return error == null && recipients.containsValue(Boolean.TRUE);
    }

    public List<String> getFailedRecipients() {
        return recipients.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .toList();
    }

    public static DeliveryResult failed(String channel, List<String> recipients, String error) {
        Map<String, Boolean> outcome = new LinkedHashMap<>();
        recipients.forEach(r -> outcome.put(r, false));
        return DeliveryResult.builder().channel(channel).recipients(outcome).error(error).build();
    }
}
