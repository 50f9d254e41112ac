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

import me.golemcore.report.domain.model.RunStage;

/**
 * Reduce did not produce a daily summary within its retry budget.
 */
public class SummarizationFailedException extends ReportPipelineException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public SummarizationFailedException(String message, int attempts, Throwable cause) {
        super(RunStage.REDUCING, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
