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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The slice of history a run covers: either everything since a relative point
 * in time, or the last N commits.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommitWindow {

    private static final Pattern RELATIVE_PATTERN = Pattern
            .compile("(\\d+)\\s+(minute|hour|day|week|month|year)s?(\\s+ago)?", Pattern.CASE_INSENSITIVE);

    Duration since;
    Integer count;

    public static CommitWindow since(Duration since) {
        if (since == null || since.isNegative() || since.isZero()) {
            throw new IllegalArgumentException("Window duration must be positive");
        }
        return new CommitWindow(since, null);
    }

    public static CommitWindow lastCommits(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Commit count must be positive: " + count);
        }
        return new CommitWindow(null, count);
    }

    /**
     * Parses "N unit(s) ago" expressions (minute, hour, day, week, month, year).
     * Months count as 30 days and years as 365.
     */
    public static CommitWindow parseSince(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty window expression");
        }
        Matcher matcher = RELATIVE_PATTERN.matcher(expression.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unsupported window expression: " + expression);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        Duration duration = switch (unit) {
        case "minute" -> Duration.ofMinutes(amount);
        case "hour" -> Duration.ofHours(amount);
        case "week" -> Duration.ofDays(amount * 7);
        case "month" -> Duration.ofDays(amount * 30);
        case "year" -> Duration.ofDays(amount * 365);
        default -> Duration.ofDays(amount);
        };
        return since(duration);
    }

    public boolean isCountBased() {
        return count != null;
    }

    public String describe() {
        if (isCountBased()) {
            return "last " + count + " commits";
        }
        long hours = since.toHours();
        if (hours > 0 && hours % 24 == 0) {
            long days = hours / 24;
            return days + (days == 1 ? " day ago" : " days ago");
        }
        if (hours > 0) {
            return hours + (hours == 1 ? " hour ago" : " hours ago");
        }
        return since.toMinutes() + " minutes ago";
    }
}
