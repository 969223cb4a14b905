package migrator.validation;

import migrator.TestGovernors;
import migrator.cache.ResponseCache;
import migrator.discovery.FileEntry;
import migrator.discovery.TreeEnumerator;
import migrator.discovery.TreeSnapshot;
import migrator.remote.InMemoryRemoteService;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private final InMemoryRemoteService remote = new InMemoryRemoteService();
    private final Validator validator = new Validator(new TreeEnumerator(remote, TestGovernors.immediate(), new ResponseCache()));

    @Test
    void validate_shouldPassForIdenticalTrees() throws Exception {
        String source = remote.addRoot("src");
        String dest = remote.addRoot("dst");
        remote.addFileAt(source, "a/b.txt", 3, "h");
        remote.addFileAt(dest, "a/b.txt", 3, "h");
        remote.addFolder(dest, "extra");

        ValidationReport report = validator.validate(source, dest);

        assertTrue(report.isPassed());
        assertEquals(1, report.getCheckedFiles());
        assertEquals(1, report.getCheckedFolders());
    }

    @Test
    void validate_shouldReportEveryKindOfDiscrepancy() {
        Map<String, FileEntry> sourceFiles = new LinkedHashMap<>();
        sourceFiles.put("missing.txt", new FileEntry("1", 4, "h", "text/plain"));
        sourceFiles.put("resized.txt", new FileEntry("2", 4, "h", "text/plain"));
        sourceFiles.put("altered.txt", new FileEntry("3", 4, "h", "text/plain"));
        sourceFiles.put("unknown.txt", new FileEntry("4", 4, "h", "text/plain"));
        Map<String, FileEntry> destFiles = new LinkedHashMap<>();
        destFiles.put("resized.txt", new FileEntry("5", 5, "h", "text/plain"));
        destFiles.put("altered.txt", new FileEntry("6", 4, "x", "text/plain"));
        destFiles.put("unknown.txt", new FileEntry("7", 4, null, "text/plain"));

        ValidationReport report = validator.validate(
                new TreeSnapshot("s", sourceFiles, Collections.singletonMap("dir", "d")),
                new TreeSnapshot("d", destFiles, Collections.<String, String>emptyMap()));

        assertFalse(report.isPassed());
        assertEquals(4, report.getDiscrepancies().size());
        assertEquals(Collections.singletonList(Discrepancy.missingFile("missing.txt", 4)),
                report.getDiscrepancies(DiscrepancyType.MISSING_FILE));
        assertEquals(Collections.singletonList(Discrepancy.sizeMismatch("resized.txt", 4, 5)),
                report.getDiscrepancies(DiscrepancyType.SIZE_MISMATCH));
        assertEquals(Collections.singletonList(Discrepancy.hashMismatch("altered.txt", 4)),
                report.getDiscrepancies(DiscrepancyType.HASH_MISMATCH));
        assertEquals(Collections.singletonList(Discrepancy.missingFolder("dir")),
                report.getDiscrepancies(DiscrepancyType.MISSING_FOLDER));
        assertTrue(report.hasMissingItems());
    }

    @Test
    void hasMissingItems_shouldIgnoreContentMismatches() {
        ValidationReport report = new ValidationReport(
                Collections.singletonList(Discrepancy.hashMismatch("a", 1)), 1, 0);

        assertFalse(report.hasMissingItems());
    }
}
