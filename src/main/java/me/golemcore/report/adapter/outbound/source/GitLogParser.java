package me.golemcore.report.adapter.outbound.source;

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


import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.FileChange;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code git log --numstat} output produced with {@link #PRETTY_FORMAT}.
 * Each commit starts with a record separator, header fields are split by unit
 * separators, and numstat lines follow the header.
 */
final class GitLogParser {

    static final String PRETTY_FORMAT = "--pretty=format:%x1e%H%x1f%an%x1f%aI%x1f%ar%x1f%D%x1f%s";

    private static final char RECORD_SEPARATOR = '\u001e';
    private static final String FIELD_SEPARATOR = "\u001f";
    private static final int HEADER_FIELDS = 6;

    private GitLogParser() {
    }

    static List<Commit> parse(String output) {
        List<Commit> commits = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return commits;
        }
        for (String record : output.split(String.valueOf(RECORD_SEPARATOR))) {
            if (record.isBlank()) {
                continue;
            }
            Commit commit = parseRecord(record);
            if (commit != null) {
                commits.add(commit);
            }
        }
        return commits;
    }

    private static Commit parseRecord(String record) {
        String[] lines = record.split("\\r?\\n");
        String[] header = lines[0].split(FIELD_SEPARATOR, -1);
        if (header.length < HEADER_FIELDS) {
            return null;
        }
        Commit.CommitBuilder builder = Commit.builder()
                .id(header[0].trim())
                .author(header[1])
                .timestamp(parseInstant(header[2]))
                .relativeTime(header[3])
                .branch(header[4].trim())
                .message(header[5]);
        for (int i = 1; i < lines.length; i++) {
            FileChange change = parseNumstat(lines[i]);
            if (change != null) {
                builder.change(change);
            }
        }
        return builder.build();
    }

    /**
     * One {@code additions<TAB>deletions<TAB>path} line; "-" counts mark binary
     * files.
     */
    static FileChange parseNumstat(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        String[] parts = line.split("\t", 3);
        if (parts.length < 3) {
            return null;
        }
        boolean binary = "-".equals(parts[0]) || "-".equals(parts[1]);
        return FileChange.builder()
                .path(resolveRenamedPath(parts[2].trim()))
                .additions(binary ? 0 : parseCount(parts[0]))
                .deletions(binary ? 0 : parseCount(parts[1]))
                .binary(binary)
                .build();
    }

    /**
     * Resolve numstat rename notation to the new path: {@code old => new} and
     * {@code dir/{old => new}/file}.
     */
    static String resolveRenamedPath(String path) {
        int arrow = path.indexOf(" => ");
        if (arrow < 0) {
            return path;
        }
        int open = path.lastIndexOf('{', arrow);
        int close = path.indexOf('}', arrow);
        if (open >= 0 && close > arrow) {
            String prefix = path.substring(0, open);
            String target = path.substring(arrow + 4, close);
            String suffix = path.substring(close + 1);
            String joined = prefix + target + suffix;
            return joined.replace("//", "/");
        }
        return path.substring(arrow + 4);
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Instant parseInstant(String value) {
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
