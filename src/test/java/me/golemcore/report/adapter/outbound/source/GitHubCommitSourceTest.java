package me.golemcore.report.adapter.outbound.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.report.domain.exception.SourceUnavailableException;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.domain.model.FileChange;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GitHubCommitSourceTest {

    private static final String REPO = "https://github.com/acme/widgets.git";
    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    private OkHttpMockEngine engine;
    private ReportProperties properties;
    private GitHubCommitSource source;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new ReportProperties();
        properties.getSource().getGithub().setApiUrl("https://api.github.test");
        properties.getSource().getGithub().setToken("ghp_test");
        source = new GitHubCommitSource(engine.client(), properties, new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @ParameterizedTest
    @ValueSource(strings = { "https://github.com/acme/widgets", "https://github.com/acme/widgets.git",
            "git@github.com:acme/widgets.git", "https://github.com/acme/widgets/" })
    void shouldParseRepositoryUrls(String url) {
        Optional<String[]> parsed = GitHubCommitSource.parseRepository(url);

        assertTrue(parsed.isPresent());
        assertArrayEquals(new String[] { "acme", "widgets" }, parsed.get());
        assertTrue(source.supports(url));
    }

    @Test
    void shouldNotSupportLocalPaths() {
        assertFalse(source.supports("/home/dev/widgets"));
        assertFalse(GitHubCommitSource.isRemote("/home/dev/widgets"));
        assertTrue(GitHubCommitSource.isRemote("ssh://git@example.com/widgets.git"));
    }

    @Test
    void shouldFetchCommitsWithFilesAndSkipMerges() {
        engine.enqueueJson(200, """
                [
                  {"sha": "aaa1111", "parents": [{"sha": "p0"}]},
                  {"sha": "mmm2222", "parents": [{"sha": "p1"}, {"sha": "p2"}]}
                ]
                """);
        engine.enqueueJson(200, """
                {"sha": "aaa1111",
                 "commit": {"author": {"name": "Dana", "date": "2026-10-19T07:00:00Z"},
                            "message": "Add widget cache\\n\\nLonger body"},
                 "files": [
                   {"filename": "src/Cache.java", "additions": 40, "deletions": 2,
                    "patch": "@@ -1 +1 @@\\n-old\\n+new"},
                   {"filename": "logo.png", "additions": 0, "deletions": 0}
                 ]}
                """);

        List<Commit> commits = source.fetch(REPO, CommitWindow.since(Duration.ofDays(1)));

        assertEquals(1, commits.size());
        Commit commit = commits.get(0);
        assertEquals("aaa1111", commit.getId());
        assertEquals("Dana", commit.getAuthor());
        assertEquals("Add widget cache", commit.getMessage());
        assertEquals(Instant.parse("2026-10-19T07:00:00Z"), commit.getTimestamp());
        assertEquals("3 hours ago", commit.getRelativeTime());
        assertEquals(2, commit.getChanges().size());
        FileChange image = commit.getChanges().get(1);
        assertTrue(image.isBinary());

        assertEquals(2, engine.getRequestCount());
        OkHttpMockEngine.CapturedRequest list = engine.request(0);
        assertEquals("/repos/acme/widgets/commits", list.request().url().encodedPath());
        assertEquals("2026-10-18T10:00:00Z", list.request().url().queryParameter("since"));
        assertEquals("100", list.request().url().queryParameter("per_page"));
        assertEquals("Bearer ghp_test", list.header("Authorization"));
        assertEquals("2022-11-28", list.header("X-GitHub-Api-Version"));
        assertEquals("/repos/acme/widgets/commits/aaa1111", engine.request(1).target());
    }

    @Test
    void shouldServeDiffFromFetchWithoutSecondRequest() {
        engine.enqueueJson(200, "[{\"sha\": \"aaa1111\", \"parents\": []}]");
        engine.enqueueJson(200, """
                {"sha": "aaa1111",
                 "commit": {"author": {"name": "Dana", "date": "2026-10-19T07:00:00Z"}, "message": "Rename"},
                 "files": [
                   {"filename": "src/New.java", "previous_filename": "src/Old.java",
                    "additions": 1, "deletions": 1, "patch": "@@ -1 +1 @@\\n-a\\n+b"},
                   {"filename": "img.png", "additions": 0, "deletions": 0}
                 ]}
                """);
        Commit commit = source.fetch(REPO, CommitWindow.lastCommits(5)).get(0);

        String diff = source.fetchDiff(REPO, commit);

        assertEquals(2, engine.getRequestCount());
        assertEquals("/repos/acme/widgets/commits?per_page=5", engine.request(0).target());
        assertTrue(diff.startsWith("diff --git a/src/Old.java b/src/New.java\n--- a/src/Old.java\n+++ b/src/New.java\n"));
        assertTrue(diff.contains("+b\n"));
        assertTrue(diff.contains("Binary files a/img.png and b/img.png differ"));
    }

    @Test
    void shouldFetchDiffOnDemandWhenNotCached() {
        engine.enqueueJson(200, """
                {"sha": "bbb2222", "files": [{"filename": "a.txt", "additions": 1, "deletions": 0,
                 "patch": "@@ -0,0 +1 @@\\n+hi"}]}
                """);

        String diff = source.fetchDiff(REPO, Commit.builder().id("bbb2222").build());

        assertTrue(diff.contains("+hi"));
        assertEquals("/repos/acme/widgets/commits/bbb2222", engine.request(0).target());
    }

    @Test
    void shouldDropUnconsumedDiffsOnNextFetch() {
        engine.enqueueJson(200, "[{\"sha\": \"aaa1111\", \"parents\": []}]");
        engine.enqueueJson(200, """
                {"sha": "aaa1111", "files": [{"filename": "package-lock.json", "additions": 900, "deletions": 0,
                 "patch": "@@ -0,0 +1 @@\\n+{}"}]}
                """);
        Commit skipped = source.fetch(REPO, CommitWindow.lastCommits(1)).get(0);
        engine.enqueueJson(200, "[{\"sha\": \"ccc3333\", \"parents\": []}]");
        engine.enqueueJson(200, """
                {"sha": "ccc3333", "files": [{"filename": "a.txt", "additions": 1, "deletions": 0,
                 "patch": "@@ -0,0 +1 @@\\n+next"}]}
                """);
        source.fetch(REPO, CommitWindow.lastCommits(1));
        engine.enqueueJson(200, """
                {"sha": "aaa1111", "files": [{"filename": "package-lock.json", "additions": 900, "deletions": 0,
                 "patch": "@@ -0,0 +1 @@\\n+{}"}]}
                """);

        source.fetchDiff(REPO, skipped);

        assertEquals(5, engine.getRequestCount());
        assertEquals("/repos/acme/widgets/commits/aaa1111", engine.request(4).target());
    }

    @Test
    void shouldReadRawReadme() {
        engine.enqueueText(200, "# Widgets\n", "text/plain");

        assertEquals(Optional.of("# Widgets\n"), source.fetchReadme(REPO));
        assertEquals("application/vnd.github.raw", engine.request(0).header("Accept"));
    }

    @Test
    void shouldReturnEmptyReadmeOn404() {
        engine.enqueueJson(404, "{\"message\": \"Not Found\"}");

        assertTrue(source.fetchReadme(REPO).isEmpty());
    }

    @Test
    void shouldDescribeAuthenticationFailure() {
        engine.enqueueJson(401, "{\"message\": \"Bad credentials\"}");

        CommitWindow window = CommitWindow.lastCommits(3);
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> source.fetch(REPO, window));
        assertTrue(e.getMessage().contains("authentication failed"));
    }

    @Test
    void shouldWrapNetworkFailures() {
        engine.enqueueFailure(new IOException("connection reset"));

        CommitWindow window = CommitWindow.lastCommits(3);
        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> source.fetch(REPO, window));
        assertTrue(e.getMessage().contains("connection reset"));
    }

    @Test
    void shouldRejectNonGitHubLocation() {
        CommitWindow window = CommitWindow.lastCommits(3);

        assertThrows(SourceUnavailableException.class, () -> source.fetch("https://gitlab.com/a/b", window));
        assertEquals(0, engine.getRequestCount());
    }
}
