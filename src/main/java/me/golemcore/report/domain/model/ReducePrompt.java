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

import java.util.List;

/**
 * Prompt context for combining the Map outputs into a daily summary.
 */
@Value
@Builder
public class ReducePrompt {

    String style;
    String projectName;
    String window;

    /** Map outputs in chronological commit order, placeholders included. */
    List<DiffSummary> diffSummaries;

    ChangeStats stats;

    /** Plain-text statistics report shown to the model. */
    String statsReport;

    /** Current project memory, empty when none exists yet. */
    String priorMemory;
}
