package me.golemcore.report.port.outbound;

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

import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.ReportArtifact;

import java.util.List;

/**
 * Port for report delivery channels (mail, chat apps, webhooks).
 */
public interface NotifierPort {

    /**
     * Channel name used in results and diagnostics.
     */
    String getChannel();

    /**
     * Whether the channel is switched on in configuration. Enabled channels may
     * still fail delivery when credentials are missing.
     */
    boolean isEnabled();

    /**
     * Deliver the artifact to every recipient. Channel-level failures are
     * reported by throwing
     * {@link me.golemcore.report.domain.exception.DeliveryException}; recipient
     * failures are reported in the returned map.
     */
    DeliveryResult deliver(ReportArtifact artifact, List<String> recipients);
}
