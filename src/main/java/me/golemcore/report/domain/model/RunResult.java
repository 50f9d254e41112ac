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

import java.time.Instant;
import java.util.List;

/**
 * Final outcome of a run.
 */
@Value
@Builder
public class RunResult {

    String runId;
    String project;
    Status status;

    /** Stage that failed, set only for {@link Status#FAILED}. */
    RunStage failedStage;
    String failureMessage;

    @Singular
    List<RunDiagnostic> diagnostics;

    DailySummary dailySummary;
    ReportArtifact artifact;

    @Singular
    List<DeliveryResult> deliveries;

    Instant startedAt;
    Instant finishedAt;

    public enum Status {
        COMPLETED, COMPLETED_WITH_WARNINGS, FAILED
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
