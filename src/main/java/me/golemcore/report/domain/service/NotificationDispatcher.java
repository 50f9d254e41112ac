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

package me.golemcore.report.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.port.outbound.NotifierPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans a finished report out to every configured channel. Channels are
 * independent: one failing never stops the others, and failures become
 * diagnostics rather than run errors.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    public List<DeliveryResult> dispatch(List<NotifierPort> notifiers, ReportArtifact artifact,
            List<String> recipients, Consumer<RunDiagnostic> diagnostics) {
        List<DeliveryResult> results = new ArrayList<>();
        if (notifiers.isEmpty()) {
            log.info("[Notify] No delivery channels enabled");
            return results;
        }
        for (NotifierPort notifier : notifiers) {
            String channel = notifier.getChannel();
            DeliveryResult result;
            try {
                result = notifier.deliver(artifact, recipients);
            } catch (RuntimeException e) { // NOSONAR - a channel must not break its siblings
                result = DeliveryResult.failed(channel, recipients, e.getMessage());
            }
            if (result.isSuccessful() && result.getFailedRecipients().isEmpty()) {
                log.info("[Notify] Channel '{}' delivered to {} recipients", channel, result.getRecipients().size());
            } else {
                String message = result.getError() != null
                        ? result.getError()
                        : "Not delivered to " + String.join(", ", result.getFailedRecipients());
                log.warn("[Notify] Channel '{}': {}", channel, message);
                diagnostics.accept(RunDiagnostic.builder()
                        .stage(RunStage.NOTIFYING)
                        .code(RunDiagnostic.Code.DELIVERY_FAILED)
                        .subject(channel)
                        .message(message)
                        .build());
            }
            results.add(result);
        }
        return results;
    }
}
