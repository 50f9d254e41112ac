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
import lombok.Value;

import java.time.Duration;

/**
 * Resolved tuning for one run's Map and Reduce phases.
 */
@Value
@Builder
public class PipelineSettings {

    @Builder.Default
    int mapConcurrency = 4;

    @Builder.Default
    Duration mapTimeout = Duration.ofMinutes(5);

    @Builder.Default
    Duration mapGracePeriod = Duration.ofSeconds(20);

    @Builder.Default
    int reduceMaxAttempts = 3;

    @Builder.Default
    Duration reduceInitialBackoff = Duration.ofSeconds(2);

    @Builder.Default
    double reduceBackoffMultiplier = 2.0;

    @Builder.Default
    int maxDiffChars = 100_000;

    @Builder.Default
    int distillEveryRuns = 1;
}
