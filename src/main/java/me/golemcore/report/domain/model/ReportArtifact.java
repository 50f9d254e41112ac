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

import java.nio.file.Path;

/**
 * Files and texts produced by rendering. The HTML report always exists; the
 * styled article and its PDF export are optional.
 */
@Value
@Builder(toBuilder = true)
public class ReportArtifact {

    String subject;
    String html;
    String textReport;
    Path htmlPath;
    String article;
    Path articlePath;
    Path pdfPath;

    /** Summary text used as a message body by chat channels. */
    String summary;

    /** The file channels should attach: the PDF when exported, else the HTML. */
    public Path getAttachment() {
        return pdfPath != null ? pdfPath : htmlPath;
    }
}
