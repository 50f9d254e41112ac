package me.golemcore.report.adapter.outbound.source;

import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.FileChange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitLogParserTest {

    private static final String RS = "\u001e";
    private static final String US = "\u001f";

    @Test
    void shouldParseHeadersAndNumstat() {
        String output = RS + String.join(US, "1111111aaaa", "Alice", "2026-10-18T09:30:00+02:00", "2 hours ago",
                "HEAD -> main, origin/main", "Add parser") + "\n"
                + "10\t2\tsrc/Parser.java\n"
                + "-\t-\tassets/logo.png\n"
                + "\n"
                + RS + String.join(US, "2222222bbbb", "Bob", "2026-10-18T08:00:00Z", "4 hours ago", "",
                        "Fix typo") + "\n"
                + "1\t1\tREADME.md\n";

        List<Commit> commits = GitLogParser.parse(output);

        assertEquals(2, commits.size());
        Commit first = commits.get(0);
        assertEquals("1111111aaaa", first.getId());
        assertEquals("Alice", first.getAuthor());
        assertEquals(Instant.parse("2026-10-18T07:30:00Z"), first.getTimestamp());
        assertEquals("HEAD -> main, origin/main", first.getBranch());
        assertEquals("Add parser", first.getMessage());
        assertEquals(2, first.getChanges().size());
        assertEquals(10, first.getChanges().get(0).getAdditions());
        assertTrue(first.getChanges().get(1).isBinary());

        Commit second = commits.get(1);
        assertFalse(second.hasBranch());
        assertEquals(1, second.getChanges().size());
    }

    @Test
    void shouldReturnEmptyListForEmptyOutput() {
        assertTrue(GitLogParser.parse("").isEmpty());
        assertTrue(GitLogParser.parse(null).isEmpty());
    }

    @Test
    void shouldResolveRenamedPaths() {
        assertEquals("src/new/File.java", GitLogParser.resolveRenamedPath("src/{old => new}/File.java"));
        assertEquals("docs/b.md", GitLogParser.resolveRenamedPath("docs/a.md => docs/b.md"));
        assertEquals("src/File.java", GitLogParser.resolveRenamedPath("src/{ => }/File.java"));
        assertEquals("plain.txt", GitLogParser.resolveRenamedPath("plain.txt"));
    }

    @Test
    void shouldIgnoreMalformedNumstatLines() {
        assertNull(GitLogParser.parseNumstat("not a numstat line"));
        FileChange change = GitLogParser.parseNumstat("3\t4\tsrc/A.java");
        assertNotNull(change);
        assertEquals(7, change.getMagnitude());
    }
}
