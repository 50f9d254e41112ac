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

package me.golemcore.report.domain.service;

import me.golemcore.report.domain.model.ChangeStats;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.FileChange;
import me.golemcore.report.domain.model.FilteredChanges;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates significant changes from noise (lockfiles, build output, IDE
 * configuration, binaries).
 *
 * <p>
 * A change is noise when any rule matches:
 * <ul>
 * <li>path ends with a denylisted suffix</li>
 * <li>path starts with a denylisted directory prefix, at the root or below any
 * directory</li>
 * <li>file name or whole path matches a {@link PathMatcher} glob,
 * case-insensitively ({@code **} spans directories)</li>
 * <li>the change is binary</li>
 * </ul>
 * Classification depends only on path and binary flag, so filtering is
 * deterministic and idempotent. Noise stays in the inventory but is excluded
 * from statistics and diffs.
 */
@Component
public class ChangeFilter {

    private static final Pattern DIFF_SECTION_HEADER = Pattern.compile("^diff --git a/(.+?) b/(.+)$");

    private final Predicate<FileChange> noise;
    private final Predicate<String> noisePath;

    @Autowired
    public ChangeFilter(ReportProperties properties) {
        this(properties.getFilter().getSuffixDenylist(),
                properties.getFilter().getPrefixDenylist(),
                properties.getFilter().getPatterns());
    }

    public ChangeFilter(List<String> suffixes, List<String> prefixes, List<String> globs) {
        this.noisePath = suffixRule(suffixes)
                .or(prefixRule(prefixes))
                .or(globRule(globs));
        Predicate<FileChange> byPath = change -> noisePath.test(normalize(change.getPath()));
        this.noise = byPath.or(FileChange::isBinary);
    }

    public boolean isNoise(FileChange change) {
        return noise.test(change);
    }

    public boolean isNoisePath(String path) {
        return noisePath.test(normalize(path));
    }

    public FilteredChanges filter(List<FileChange> changes) {
        List<FileChange> inventory = new ArrayList<>(changes.size());
        List<FileChange> significant = new ArrayList<>();
        int additions = 0;
        int deletions = 0;
        for (FileChange change : changes) {
            boolean keep = !isNoise(change);
            FileChange classified = change.withSignificant(keep);
            inventory.add(classified);
            if (keep) {
                significant.add(classified);
                additions += classified.getAdditions();
                deletions += classified.getDeletions();
            }
        }
        return new FilteredChanges(inventory, significant, additions, deletions);
    }

    /**
     * Aggregate statistics over the significant changes of all commits, merged
     * per path in first-seen order.
     */
    public ChangeStats summarize(List<Commit> commits) {
        Map<String, int[]> perFile = new LinkedHashMap<>();
        Map<String, Boolean> excluded = new LinkedHashMap<>();
        int additions = 0;
        int deletions = 0;
        for (Commit commit : commits) {
            FilteredChanges filtered = filter(commit.getChanges());
            additions += filtered.additions();
            deletions += filtered.deletions();
            for (FileChange change : filtered.significant()) {
                int[] counts = perFile.computeIfAbsent(change.getPath(), k -> new int[2]);
                counts[0] += change.getAdditions();
                counts[1] += change.getDeletions();
            }
            filtered.excludedPaths().forEach(path -> excluded.put(path, Boolean.TRUE));
        }

        ChangeStats.ChangeStatsBuilder builder = ChangeStats.builder()
                .commitCount(commits.size())
                .additions(additions)
                .deletions(deletions)
                .excludedPaths(excluded.keySet());
        perFile.forEach((path, counts) -> builder.fileStat(new ChangeStats.FileStat(path, counts[0], counts[1])));
        return builder.build();
    }

    /**
     * Drop the sections of a unified diff that belong to noise paths or to
     * binary files.
     */
    public String filterDiff(String diff) {
        if (diff == null || diff.isBlank()) {
            return "";
        }
        StringBuilder result = new StringBuilder(diff.length());
        StringBuilder section = new StringBuilder();
        boolean keepSection = true;
        for (String line : diff.split("\n", -1)) {
            Matcher header = DIFF_SECTION_HEADER.matcher(line);
            if (header.matches()) {
                flushSection(result, section, keepSection);
                keepSection = !isNoisePath(header.group(2));
            } else if (line.startsWith("Binary files ") && line.endsWith(" differ")) {
                keepSection = false;
            }
            section.append(line).append('\n');
        }
        flushSection(result, section, keepSection);
        return result.toString().strip();
    }

    private void flushSection(StringBuilder result, StringBuilder section, boolean keep) {
        if (keep) {
            result.append(section);
        }
        section.setLength(0);
    }

    private static Predicate<String> suffixRule(List<String> suffixes) {
        List<String> normalized = lower(suffixes);
        return path -> {
            String lowerPath = path.toLowerCase(Locale.ROOT);
            return normalized.stream().anyMatch(lowerPath::endsWith);
        };
    }

    private static Predicate<String> prefixRule(List<String> prefixes) {
        List<String> normalized = lower(prefixes).stream()
                .map(prefix -> prefix.endsWith("/") ? prefix : prefix + "/")
                .toList();
        return path -> {
            String lowerPath = path.toLowerCase(Locale.ROOT);
            return normalized.stream()
                    .anyMatch(prefix -> lowerPath.startsWith(prefix) || lowerPath.contains("/" + prefix));
        };
    }

    private static Predicate<String> globRule(List<String> globs) {
        List<PathMatcher> matchers = lower(globs).stream().map(ChangeFilter::globMatcher).toList();
        return path -> {
            Path full = Path.of(path.toLowerCase(Locale.ROOT));
            Path fileName = full.getFileName();
            return matchers.stream()
                    .anyMatch(m -> m.matches(full) || fileName != null && m.matches(fileName));
        };
    }

    static PathMatcher globMatcher(String glob) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob.toLowerCase(Locale.ROOT));
    }

    private static List<String> lower(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }
}
