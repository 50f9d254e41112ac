package me.golemcore.report.domain.service;

import me.golemcore.report.domain.model.ChangeStats;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.FileChange;
import me.golemcore.report.domain.model.FilteredChanges;
import me.golemcore.report.infrastructure.config.ReportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFilterTest {

    private ChangeFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ChangeFilter(new ReportProperties());
    }

    @Test
    void shouldTreatLockfilesAndBuildOutputAsNoise() {
        assertTrue(filter.isNoisePath("package-lock.json"));
        assertTrue(filter.isNoisePath("frontend/pnpm-lock.yaml"));
        assertTrue(filter.isNoisePath("Cargo.lock"));
        assertTrue(filter.isNoisePath("dist/app.js"));
        assertTrue(filter.isNoisePath("web/node_modules/react/index.js"));
        assertTrue(filter.isNoisePath("static/app.min.js"));
        assertTrue(filter.isNoisePath("pkg/__pycache__/mod.cpython-311.pyc"));
        assertTrue(filter.isNoisePath(".idea/workspace.xml"));
        assertTrue(filter.isNoisePath("docs/logo.PNG"));
        assertTrue(filter.isNoisePath(".env"));
    }

    @Test
    void shouldKeepSourceFiles() {
        assertFalse(filter.isNoisePath("src/main/java/App.java"));
        assertFalse(filter.isNoisePath("README.md"));
        assertFalse(filter.isNoisePath("builder/Builder.java"));
        assertFalse(filter.isNoisePath("docs/distribution.md"));
    }

    @Test
    void shouldTreatBinaryChangesAsNoise() {
        FileChange binary = FileChange.builder().path("assets/model.bin").binary(true).build();
        assertTrue(filter.isNoise(binary));
    }

    @Test
    void shouldSplitInventoryFromSignificantChanges() {
        FilteredChanges result = filter.filter(List.of(
                change("src/App.java", 10, 2),
                change("package-lock.json", 500, 300),
                change("src/Util.java", 3, 1)));

        assertEquals(3, result.inventory().size());
        assertEquals(2, result.significant().size());
        assertEquals(13, result.additions());
        assertEquals(3, result.deletions());
        assertEquals(List.of("package-lock.json"), result.excludedPaths());
        assertFalse(result.inventory().get(1).isSignificant());
    }

    @Test
    void shouldBeIdempotentWhenAppliedTwice() {
        FilteredChanges once = filter.filter(List.of(
                change("src/App.java", 10, 2),
                change("yarn.lock", 80, 40),
                change("build/classes/App.class", 0, 0),
                FileChange.builder().path("assets/icon.bin").binary(true).build(),
                change("docs/guide.md", 5, 0)));

        FilteredChanges twice = filter.filter(once.inventory());

        assertEquals(once, twice);
        assertEquals(List.of("yarn.lock", "build/classes/App.class", "assets/icon.bin"), twice.excludedPaths());
        assertEquals(15, twice.additions());
        assertEquals(2, twice.deletions());
    }

    @Test
    void shouldMergeFileStatsAcrossCommits() {
        Commit first = Commit.builder().id("a1").author("alice").message("one")
                .change(change("src/App.java", 10, 0))
                .change(change("yarn.lock", 40, 40))
                .build();
        Commit second = Commit.builder().id("b2").author("bob").message("two")
                .change(change("src/App.java", 5, 3))
                .change(change("src/New.java", 20, 0))
                .build();

        ChangeStats stats = filter.summarize(List.of(first, second));

        assertEquals(2, stats.getCommitCount());
        assertEquals(35, stats.getAdditions());
        assertEquals(3, stats.getDeletions());
        assertEquals(2, stats.getFilesChanged());
        assertEquals("src/App.java", stats.getFileStats().get(0).getPath());
        assertEquals(15, stats.getFileStats().get(0).getAdditions());
        assertEquals(3, stats.getFileStats().get(0).getDeletions());
        assertEquals(List.of("yarn.lock"), stats.getExcludedPaths());
    }

    @Test
    void shouldDropNoiseSectionsFromUnifiedDiff() {
        String diff = String.join("\n",
                "diff --git a/src/App.java b/src/App.java",
                "--- a/src/App.java",
                "+++ b/src/App.java",
                "+int x = 1;",
                "diff --git a/package-lock.json b/package-lock.json",
                "--- a/package-lock.json",
                "+++ b/package-lock.json",
                "+\"lockfileVersion\": 3",
                "diff --git a/img/logo.bin b/img/logo.bin",
                "Binary files a/img/logo.bin and b/img/logo.bin differ");

        String filtered = filter.filterDiff(diff);

        assertTrue(filtered.contains("+int x = 1;"));
        assertFalse(filtered.contains("lockfileVersion"));
        assertFalse(filtered.contains("logo.bin"));
    }

    @Test
    void shouldReturnEmptyDiffWhenOnlyNoiseChanged() {
        String diff = "diff --git a/poetry.lock b/poetry.lock\n+content-hash = \"abc\"";
        assertEquals("", filter.filterDiff(diff));
        assertEquals("", filter.filterDiff(null));
    }

    @Test
    void shouldMatchGlobsAgainstFileNameOrWholePath() {
        assertTrue(ChangeFilter.globMatcher("*.tar.gz").matches(Path.of("release.tar.gz")));
        assertFalse(ChangeFilter.globMatcher("*.tar.gz").matches(Path.of("release.tar.gzip")));
        assertTrue(ChangeFilter.globMatcher("build/*").matches(Path.of("build/out.txt")));
        assertFalse(ChangeFilter.globMatcher("gen/*").matches(Path.of("gen/a/b.txt")));
        assertTrue(ChangeFilter.globMatcher("gen/**").matches(Path.of("gen/a/b.txt")));

        ChangeFilter custom = new ChangeFilter(List.of(), List.of(), List.of("*.snap", "generated/**"));
        assertTrue(custom.isNoisePath("web/__tests__/App.test.js.SNAP"));
        assertTrue(custom.isNoisePath("generated/api/Client.java"));
        assertFalse(custom.isNoisePath("src/generated.java"));
    }

    private static FileChange change(String path, int additions, int deletions) {
        return FileChange.builder().path(path).additions(additions).deletions(deletions).build();
    }
}
