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

/**
 * A non-fatal problem recorded during a run and reported with its result.
 */
@Value
@Builder
public class RunDiagnostic {

    RunStage stage;
    Code code;

    /** What the problem concerns: a commit id, a channel name, a hook name. */
    String subject;

    String message;

    public enum Code {
        MAP_ITEM_FAILED, MAP_ITEM_CANCELLED, DISTILL_FAILED, ARTICLE_FAILED, EXPORT_FAILED, HOOK_FAILED,
        DELIVERY_FAILED, README_UNAVAILABLE
    }

    @Override
    public String toString() {
        return "[" + stage + "/" + code + "] " + subject + ": " + message;
    }
}
