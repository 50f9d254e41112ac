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
 * Map-phase output for one commit. Exists only within a single run.
 */
@Value
@Builder(toBuilder = true)
public class DiffSummary {

    /** Chronological position of the source commit (0 = oldest). */
    int index;
    String commitId;
    String author;
    String message;
    String text;
    Status status;

    public enum Status {
        SUMMARIZED, SKIPPED, FAILED, CANCELLED
    }

    public boolean isDegraded() {
        return status == Status.FAILED || status == Status.CANCELLED;
    }

    public static DiffSummary placeholder(int index, Commit commit, Status status) {
        return DiffSummary.builder()
                .index(index)
                .commitId(commit.getShortId())
                .author(commit.getAuthor())
                .message(commit.getMessage())
                .text("(summary unavailable for commit " + commit.getShortId() + ")")
                .status(status)
                .build();
    }
}
