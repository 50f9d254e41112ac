package me.golemcore.report.adapter.outbound.source;

import me.golemcore.report.domain.exception.SourceUnavailableException;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.CommitWindow;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.infrastructure.process.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class LocalGitCommitSourceTest {

    private static final String LOG_OUTPUT = "\u001e" + String.join("\u001f", "abc123", "Alice",
            "2026-10-18T09:30:00Z", "1 day ago", "HEAD -> main", "Add exporter") + "\n"
            + "12\t3\tsrc/Exporter.java\n";

    @TempDir
    Path workTree;

    private ProcessRunner processRunner;
    private LocalGitCommitSource source;

    @BeforeEach
    void setUp() {
        processRunner = mock(ProcessRunner.class);
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);
        source = new LocalGitCommitSource(processRunner, new ReportProperties(), clock);
    }

    @Test
    void shouldSupportOnlyLocalPaths() {
        assertTrue(source.supports("/work/widgets"));
        assertFalse(source.supports("https://github.com/acme/widgets"));
        assertFalse(source.supports(" "));
        assertFalse(source.supports(null));
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldRunGitLogWithSinceWindow() throws Exception {
        when(processRunner.run(anyList(), any(), isNull(), any()))
                .thenReturn(new ProcessRunner.ProcessOutput(0, LOG_OUTPUT, ""));

        List<Commit> commits = source.fetch(workTree.toString(), CommitWindow.since(Duration.ofDays(1)));

        assertEquals(1, commits.size());
        assertEquals("abc123", commits.get(0).getId());
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(processRunner).run(command.capture(), eq(workTree.toAbsolutePath().normalize()), isNull(),
                eq(Duration.ofMillis(60000)));
        assertEquals("git", command.getValue().get(0));
        assertTrue(command.getValue().contains("--numstat"));
        assertTrue(command.getValue().contains("--since=2026-10-18T12:00:00Z"));
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldLimitByCommitCount() throws Exception {
        when(processRunner.run(anyList(), any(), isNull(), any()))
                .thenReturn(new ProcessRunner.ProcessOutput(0, "", ""));

        assertTrue(source.fetch(workTree.toString(), CommitWindow.lastCommits(5)).isEmpty());

        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(processRunner).run(command.capture(), any(), isNull(), any());
        List<String> args = command.getValue();
        assertEquals("5", args.get(args.indexOf("-n") + 1));
    }

    @Test
    void shouldFailWhenGitExitsWithError() throws Exception {
        when(processRunner.run(anyList(), any(), isNull(), any()))
                .thenReturn(new ProcessRunner.ProcessOutput(128, "", "fatal: not a git repository\n"));

        SourceUnavailableException error = assertThrows(SourceUnavailableException.class,
                () -> source.fetch(workTree.toString(), CommitWindow.lastCommits(1)));
        assertTrue(error.getMessage().contains("not a git repository"));
    }

    @Test
    void shouldFailWhenGitTimesOut() throws Exception {
        when(processRunner.run(anyList(), any(), isNull(), any()))
                .thenThrow(new TimeoutException("git timed out after 60s"));

        assertThrows(SourceUnavailableException.class,
                () -> source.fetchDiff(workTree.toString(), Commit.builder().id("abc123").build()));
    }

    @Test
    void shouldFailForMissingDirectory() {
        String missing = workTree.resolve("nope").toString();

        assertThrows(SourceUnavailableException.class, () -> source.fetch(missing, CommitWindow.lastCommits(1)));
        verifyNoInteractions(processRunner);
    }

    @Test
    void shouldReadReadmeWhenPresent() throws IOException {
        assertTrue(source.fetchReadme(workTree.toString()).isEmpty());

        Files.writeString(workTree.resolve("README.md"), "# Widgets");

        assertEquals("# Widgets", source.fetchReadme(workTree.toString()).orElseThrow());
    }
}
