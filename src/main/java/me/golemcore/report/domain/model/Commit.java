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
import java.util.Locale;

/**
 * An immutable commit record yielded by a commit source.
 */
@Value
@Builder(toBuilder = true)
public class Commit {

    String id;
    String author;
    Instant timestamp;

    /** Human-readable age as reported by the source, e.g. "3 hours ago". */
    String relativeTime;

    /** First line of the commit message. */
    String message;

    /** Ref decoration (branch / tag names), empty when unknown. */
    String branch;

    @Singular
    List<FileChange> changes;

    public boolean isMerge() {
        return message != null && message.trim().toLowerCase(Locale.ROOT).startsWith("merge");
    }

    public boolean hasBranch() {
        return branch != null && !branch.isBlank();
    }

    public String getShortId() {
        if (id == null) {
            return "";
        }
        return id.length() > 7 ? id.substring(0, 7) : id;
    }
}
