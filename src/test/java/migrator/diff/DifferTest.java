package migrator.diff;

import migrator.discovery.FileEntry;
import migrator.discovery.TreeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DifferTest {

    private final Differ differ = new Differ();

    @Test
    void diff_shouldPlanMissingNestedFile() {
        TreeSnapshot source = snapshot(files("a/b/c.txt", new FileEntry("src1", 10, "m", "text/plain")), folders("a", "a/b"));
        TreeSnapshot dest = snapshot(Collections.<String, FileEntry>emptyMap(), Collections.<String, String>emptyMap());

        DiffPlan plan = differ.diff(source, dest);

        assertEquals(Collections.singletonList(new PlannedCopy("src1", "a/b/c.txt")), plan.getCopies());
        assertEquals(Arrays.asList("a", "a/b"), differ.missingFolders(source, dest));
    }

    @Test
    void diff_shouldSkipIdenticalFile() {
        TreeSnapshot source = snapshot(files("x", new FileEntry("s", 5, "h", "text/plain")), Collections.<String, String>emptyMap());
        TreeSnapshot dest = snapshot(files("x", new FileEntry("d", 5, "h", "text/plain")), Collections.<String, String>emptyMap());

        assertTrue(differ.diff(source, dest).isEmpty());
    }

    @Test
    void diff_shouldPlanSizeMismatchEvenWithoutHashes() {
        TreeSnapshot source = snapshot(files("x", new FileEntry("s", 5, null, "text/plain")), Collections.<String, String>emptyMap());
        TreeSnapshot dest = snapshot(files("x", new FileEntry("d", 6, null, "text/plain")), Collections.<String, String>emptyMap());

        DiffPlan plan = differ.diff(source, dest);

        assertEquals(1, plan.size());
        assertTrue(plan.containsPath("x"));
    }

    @Test
    void diff_shouldPlanHashMismatchOnlyWhenBothHashesKnown() {
        TreeSnapshot source = snapshot(files("x", new FileEntry("s", 5, "h1", "text/plain"),
                "y", new FileEntry("s2", 5, "h1", "text/plain")), Collections.<String, String>emptyMap());
        TreeSnapshot dest = snapshot(files("x", new FileEntry("d", 5, "h2", "text/plain"),
                "y", new FileEntry("d2", 5, null, "text/plain")), Collections.<String, String>emptyMap());

        DiffPlan plan = differ.diff(source, dest);

        assertTrue(plan.containsPath("x"));
        assertFalse(plan.containsPath("y"));
    }

    @Test
    void diff_shouldIgnoreDestinationOnlyFiles() {
        TreeSnapshot source = snapshot(Collections.<String, FileEntry>emptyMap(), Collections.<String, String>emptyMap());
        TreeSnapshot dest = snapshot(files("extra.txt", new FileEntry("d", 1, "h", "text/plain")), folders("extra"));

        assertTrue(differ.diff(source, dest).isEmpty());
        assertTrue(differ.missingFolders(source, dest).isEmpty());
    }

    @Test
    void missingFolders_shouldListParentsBeforeChildren() {
        TreeSnapshot source = snapshot(Collections.<String, FileEntry>emptyMap(), folders("z/y/x", "b", "z/y", "a", "z", "kept"));
        TreeSnapshot dest = snapshot(Collections.<String, FileEntry>emptyMap(), folders("kept"));

        assertEquals(Arrays.asList("a", "b", "z", "z/y", "z/y/x"), differ.missingFolders(source, dest));
    }

    private static TreeSnapshot snapshot(Map<String, FileEntry> files, Map<String, String> folders) {
        return new TreeSnapshot("root", files, folders);
    }

    private static Map<String, FileEntry> files(Object... pathsAndEntries) {
        Map<String, FileEntry> files = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndEntries.length; i += 2) {
            files.put((String) pathsAndEntries[i], (FileEntry) pathsAndEntries[i + 1]);
        }
        return files;
    }

    private static Map<String, String> folders(String... paths) {
        Map<String, String> folders = new LinkedHashMap<>();
        for (String path : paths) {
            folders.put(path, "id-" + path);
        }
        return folders;
    }
}
