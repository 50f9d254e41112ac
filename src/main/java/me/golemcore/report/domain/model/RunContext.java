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
import me.golemcore.report.domain.service.MemoryStore;
import me.golemcore.report.port.outbound.CommitSourcePort;
import me.golemcore.report.port.outbound.LlmPort;
import me.golemcore.report.port.outbound.NotifierPort;

import java.time.Instant;
import java.util.List;

/**
 * Everything one run needs, resolved once before the run starts and read-only
 * afterwards: configuration choices plus the selected provider, commit source,
 * memory handle and notifiers. Never shared between runs.
 */
@Value
@Builder(toBuilder = true)
public class RunContext {

    String runId;
    String projectName;
    String repository;
    CommitWindow window;
    String providerId;
    String style;
    AttachFormat attachFormat;

    @Singular
    List<String> recipients;

    boolean forceDistill;
    PipelineSettings settings;
    Instant startedAt;

    LlmPort llm;
    CommitSourcePort commitSource;
    MemoryStore memoryStore;

    @Singular
    List<NotifierPort> notifiers;

    /** Shared with the project coordinator so a run can be cancelled. */
    CancellationToken cancellationToken;

    public boolean isDefaultStyle() {
        return style == null || "default".equals(style);
    }
}
