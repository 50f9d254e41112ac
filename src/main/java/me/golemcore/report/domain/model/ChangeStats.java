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

import java.util.List;

/**
 * Aggregate statistics over the significant changes of a run. File entries are
 * merged per path.
 */
@Value
@Builder
public class ChangeStats {

    int commitCount;
    int additions;
    int deletions;

    @Singular
    List<FileStat> fileStats;

    /** Paths that were classified as noise, kept for the raw inventory. */
    @Singular
    List<String> excludedPaths;

    public int getFilesChanged() {
        return fileStats.size();
    }

    public int getMagnitude() {
        return additions + deletions;
    }

    public static ChangeStats empty() {
        return ChangeStats.builder().build();
    }

    @Value
    public static class FileStat {
        String path;
        int additions;
        int deletions;
    }
}
