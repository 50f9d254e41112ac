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

package me.golemcore.report.adapter.outbound.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.SourceUnavailableException;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.domain.model.FileChange;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.CommitSourcePort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads history of a GitHub-hosted repository through the REST API.
 *
 * <p>
 * The commit list endpoint carries no file statistics, so every commit is
 * fetched individually; the patches from that call are kept until
 * {@link #fetchDiff} consumes them or the next fetch of the same repository
 * replaces them.
 */
@Component
@Slf4j
public class GitHubCommitSource implements CommitSourcePort {

    private static final String SOURCE_TYPE = "github";
    private static final Pattern REPO_PATTERN = Pattern
            .compile("github\\.com[/:]([^/\\s]+)/([^/\\s]+?)(?:\\.git)?/?$");
    private static final int MAX_PAGE_SIZE = 100;

    private final OkHttpClient okHttpClient;
    private final ReportProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, String> pendingDiffs = new ConcurrentHashMap<>();

    public GitHubCommitSource(OkHttpClient okHttpClient, ReportProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    static boolean isRemote(String repository) {
        String value = repository.trim();
        return value.startsWith("http://") || value.startsWith("https://") || value.startsWith("git@")
                || value.startsWith("ssh://");
    }

    /**
     * Owner and repository name from an https or ssh GitHub URL.
     */
    static Optional<String[]> parseRepository(String repository) {
        if (repository == null) {
            return Optional.empty();
        }
        Matcher matcher = REPO_PATTERN.matcher(repository.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new String[] { matcher.group(1), matcher.group(2) });
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    public boolean supports(String repository) {
        return parseRepository(repository).isPresent();
    }

    @Override
    public List<Commit> fetch(String repository, CommitWindow window) {
        String[] repo = requireRepository(repository);
        int limit = properties.getSource().getGithub().getMaxCommits();
        HttpUrl.Builder url = repoUrl(repo).addPathSegment("commits");
        if (window.isCountBased()) {
            url.addQueryParameter("per_page", String.valueOf(Math.min(window.getCount(), MAX_PAGE_SIZE)));
        } else {
            Instant since = clock.instant().minus(window.getSince()).truncatedTo(ChronoUnit.SECONDS);
            url.addQueryParameter("since", since.toString());
            url.addQueryParameter("per_page", String.valueOf(Math.min(limit, MAX_PAGE_SIZE)));
        }
        String keyPrefix = diffKey(repository, "");
        pendingDiffs.keySet().removeIf(key -> key.startsWith(keyPrefix));
        List<CommitEntry> entries = get(url.build(), new TypeReference<List<CommitEntry>>() {
        });

        List<Commit> commits = new ArrayList<>();
        for (CommitEntry entry : entries) {
            if (entry.getParents() != null && entry.getParents().size() > 1) {
                continue;
            }
            CommitEntry detail = get(repoUrl(repo).addPathSegment("commits").addPathSegment(entry.getSha()).build(),
                    new TypeReference<CommitEntry>() {
                    });
            commits.add(toCommit(detail));
            pendingDiffs.put(diffKey(repository, detail.getSha()), buildDiff(detail));
        }
        log.info("[Source] {} commits from GitHub {}/{} ({})", commits.size(), repo[0], repo[1], window.describe());
        return commits;
    }

    @Override
    public String fetchDiff(String repository, Commit commit) {
        String cached = pendingDiffs.remove(diffKey(repository, commit.getId()));
        if (cached != null) {
            return cached;
        }
        String[] repo = requireRepository(repository);
        CommitEntry detail = get(repoUrl(repo).addPathSegment("commits").addPathSegment(commit.getId()).build(),
                new TypeReference<CommitEntry>() {
                });
        return buildDiff(detail);
    }

    @Override
    public Optional<String> fetchReadme(String repository) {
        String[] repo = requireRepository(repository);
        Request request = authorized(new Request.Builder()
                .url(repoUrl(repo).addPathSegment("readme").build())
                .header("Accept", "application/vnd.github.raw"))
                .build();
        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new SourceUnavailableException(describeFailure(response.code(), "readme"));
            }
            return Optional.of(body.string());
        } catch (IOException e) {
            throw new SourceUnavailableException("GitHub readme request failed: " + e.getMessage(), e);
        }
    }

    private <T> T get(HttpUrl url, TypeReference<T> type) {
        Request request = authorized(new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json"))
                .build();
        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new SourceUnavailableException(describeFailure(response.code(), url.encodedPath()));
            }
            return objectMapper.readValue(body.string(), type);
        } catch (IOException e) {
            throw new SourceUnavailableException("GitHub request failed: " + e.getMessage(), e);
        }
    }

    private Request.Builder authorized(Request.Builder builder) {
        String token = properties.getSource().getGithub().getToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.header("X-GitHub-Api-Version", "2022-11-28");
    }

    private static String describeFailure(int code, String what) {
        return switch (code) {
        case 401 -> "GitHub authentication failed for " + what + ". Check the configured token";
        case 403 -> "GitHub denied access to " + what + " (forbidden or rate limited)";
        case 404 -> "GitHub repository or resource not found: " + what;
        default -> "GitHub request for " + what + " failed with HTTP " + code;
        };
    }

    private HttpUrl.Builder repoUrl(String[] repo) {
        HttpUrl base = HttpUrl.parse(properties.getSource().getGithub().getApiUrl());
        if (base == null) {
            throw new SourceUnavailableException(
                    "Invalid GitHub API url: " + properties.getSource().getGithub().getApiUrl());
        }
        return base.newBuilder().addPathSegment("repos").addPathSegment(repo[0]).addPathSegment(repo[1]);
    }

    private static String[] requireRepository(String repository) {
        return parseRepository(repository)
                .orElseThrow(() -> new SourceUnavailableException("Not a GitHub repository URL: " + repository));
    }

    private static String diffKey(String repository, String sha) {
        return repository.trim() + "@" + sha;
    }

    private Commit toCommit(CommitEntry entry) {
        CommitInfo info = entry.getCommit();
        Instant timestamp = info != null && info.getAuthor() != null && info.getAuthor().getDate() != null
                ? OffsetDateTime.parse(info.getAuthor().getDate()).toInstant()
                : null;
        Commit.CommitBuilder builder = Commit.builder()
                .id(entry.getSha())
                .author(info != null && info.getAuthor() != null ? info.getAuthor().getName() : "unknown")
                .timestamp(timestamp)
                .relativeTime(timestamp != null ? relativeTime(timestamp) : "")
                .message(firstLine(info != null ? info.getMessage() : ""))
                .branch("");
        if (entry.getFiles() != null) {
            for (FileEntry file : entry.getFiles()) {
                boolean binary = file.getPatch() == null && file.getAdditions() == 0 && file.getDeletions() == 0;
                builder.change(FileChange.builder()
                        .path(file.getFilename())
                        .additions(file.getAdditions())
                        .deletions(file.getDeletions())
                        .binary(binary)
                        .build());
            }
        }
        return builder.build();
    }

    private static String buildDiff(CommitEntry entry) {
        if (entry.getFiles() == null) {
            return "";
        }
        StringBuilder diff = new StringBuilder();
        for (FileEntry file : entry.getFiles()) {
            String oldPath = file.getPreviousFilename() != null ? file.getPreviousFilename() : file.getFilename();
            diff.append("diff --git a/").append(oldPath).append(" b/").append(file.getFilename()).append('\n');
            if (file.getPatch() == null) {
                diff.append("Binary files a/").append(oldPath).append(" and b/").append(file.getFilename())
                        .append(" differ\n");
                continue;
            }
            diff.append("--- a/").append(oldPath).append('\n');
            diff.append("+++ b/").append(file.getFilename()).append('\n');
            diff.append(file.getPatch());
            if (!file.getPatch().endsWith("\n")) {
                diff.append('\n');
            }
        }
        return diff.toString();
    }

    private String relativeTime(Instant timestamp) {
        Duration age = Duration.between(timestamp, clock.instant());
        if (age.toDays() > 0) {
            return plural(age.toDays(), "day");
        }
        if (age.toHours() > 0) {
            return plural(age.toHours(), "hour");
        }
        return plural(Math.max(age.toMinutes(), 0), "minute");
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s") + " ago";
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline).trim() : message.trim();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CommitEntry {
        private String sha;
        private CommitInfo commit;
        private List<ParentRef> parents;
        private List<FileEntry> files;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CommitInfo {
        private PersonInfo author;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PersonInfo {
        private String name;
        private String date;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ParentRef {
        private String sha;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FileEntry {
        private String filename;
        @JsonProperty("previous_filename")
        private String previousFilename;
        private int additions;
        private int deletions;
        private String patch;
    }
}
