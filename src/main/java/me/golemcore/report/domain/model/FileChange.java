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
 * A single changed path within a commit, with line statistics.
 *
 * <p>
 * {@code significant} is assigned by
 * {@link me.golemcore.report.domain.service.ChangeFilter}; a freshly fetched
 * change is significant until classified.
 */
@Value
@Builder(toBuilder = true)
public class FileChange {

    String path;
    int additions;
    int deletions;

    /** True when the source reports no line counts (git numstat "-"). */
    @Builder.Default
    boolean binary = false;

    @Builder.Default
    boolean significant = true;

    public FileChange withSignificant(boolean value) {
        if (value == significant) {
            return this;
        }
        return toBuilder().significant(value).build();
    }

    public int getMagnitude() {
        return additions + deletions;
    }
}
