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
 * The commit source could not be reached or refused access. Fatal to the run.
 */
public class SourceUnavailableException extends ReportPipelineException {

    private static final long serialVersionUID = 1L;

    public SourceUnavailableException(String message) {
        super(RunStage.FETCHING, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(RunStage.FETCHING, message, cause);
    }
}
