package migrator.sync;

import migrator.Config;
import migrator.TestGovernors;
import migrator.cache.ResponseCache;
import migrator.progress.ProgressCounters;
import migrator.progress.ProgressListener;
import migrator.remote.InMemoryRemoteService;
import migrator.remote.PermanentServiceException;
import migrator.remote.RemoteNode;
import migrator.validation.DiscrepancyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {

    private InMemoryRemoteService remote;
    private String source;
    private String dest;

    @BeforeEach
    void setUp() {
        remote = new InMemoryRemoteService(3);
        source = remote.addRoot("Source");
        dest = remote.addRoot("Destination");
    }

    @Test
    void run_shouldCreateParentFoldersBeforeCopyingNestedFile() throws Exception {
        remote.addFileAt(source, "a/b/c.txt", 10, "m");

        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess(), String.valueOf(result));
        assertEquals(SyncState.DONE, result.getState());
        RemoteNode copy = remote.resolve(dest, "a/b/c.txt").orElseThrow(AssertionError::new);
        assertEquals(10, copy.getSize());
        assertEquals("m", copy.getContentHash());
        assertEquals(1, result.getCounters().getSuccessfulCopies());
        assertEquals(2, result.getCounters().getCreatedFolders());
        assertTrue(result.getValidation().get().isPassed());
    }

    @Test
    void run_shouldDoNothingOnSecondPass() throws Exception {
        remote.addFileAt(source, "a/b/c.txt", 10, "m");
        remote.addFileAt(source, "d.txt", 3, "n");
        remote.addFolder(source, "empty");
        assertTrue(engine(config(true, true)).run().isSuccess());
        int nodes = remote.getNodeCount();
        remote.resetCallCounts();

        SyncResult second = engine(config(true, true)).run();

        assertTrue(second.isSuccess());
        assertEquals(0, second.getPlannedCopies());
        assertEquals(0, second.getMissingFolders());
        assertEquals(0, remote.getCallCount(InMemoryRemoteService.COPY_FILE));
        assertEquals(0, remote.getCallCount(InMemoryRemoteService.CREATE_FOLDER));
        assertEquals(nodes, remote.getNodeCount());
    }

    @Test
    void run_shouldNeverRemoveDestinationItems() throws Exception {
        remote.addFileAt(source, "keep/me.txt", 1, "a");
        String extraFolder = remote.addFolder(dest, "extra");
        String extraFile = remote.addFile(extraFolder, "old.txt", 7, "z");

        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess());
        assertTrue(remote.getMetadata(extraFolder).isPresent());
        assertTrue(remote.getMetadata(extraFile).isPresent());
        assertTrue(remote.resolve(dest, "keep/me.txt").isPresent());
    }

    @Test
    void run_shouldCopyChangedFileAgain() throws Exception {
        String file = remote.addFile(source, "report.csv", 100, "v1");
        assertTrue(engine(config(true, true)).run().isSuccess());

        remote.updateFile(file, 120, "v2");
        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess(), String.valueOf(result));
        assertEquals(1, result.getPlannedCopies());
        assertEquals("v2", remote.resolve(dest, "report.csv").get().getContentHash());
    }

    @Test
    void run_shouldFailPreflightWithoutAnyWork() throws Exception {
        Config config = Config.fromJson("{\"source\": {\"folderId\": \"missing\"}, \"destination\": {\"folderId\": \"" + dest + "\"}}");

        SyncResult result = engine(config).run();

        assertEquals(SyncState.FAILED, result.getState());
        assertFalse(result.isSuccess());
        assertTrue(result.getFailureReason().isPresent());
        assertEquals(0, remote.getCallCount(InMemoryRemoteService.LIST_CHILDREN));
        assertEquals(0, remote.getCallCount(InMemoryRemoteService.COPY_FILE));
    }

    @Test
    void run_shouldFailPreflightWhenRootIsAFile() throws Exception {
        String file = remote.addFile(source, "not-a-folder.txt", 1, "h");

        SyncResult result = engine(Config.fromJson(
                "{\"source\": {\"folderId\": \"" + file + "\"}, \"destination\": {\"folderId\": \"" + dest + "\"}}")).run();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(0, remote.getCallCount(InMemoryRemoteService.LIST_CHILDREN));
    }

    @Test
    void run_shouldContinueAfterCopyFailureAndEndFailed() throws Exception {
        String broken = remote.addFile(source, "broken.bin", 5, "b");
        remote.addFile(source, "fine.bin", 5, "f");
        remote.failNext(InMemoryRemoteService.COPY_FILE, broken,
                new PermanentServiceException("Cannot copy", 403, "cannotCopyFile", null));

        SyncResult result = engine(config(true, true)).run();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(Collections.singletonList("broken.bin"), result.getFailedPaths());
        assertEquals(1, result.getCounters().getFailedCopies());
        assertEquals(1, result.getCounters().getSuccessfulCopies());
        assertTrue(remote.resolve(dest, "fine.bin").isPresent());
        assertFalse(result.getValidation().isPresent());
    }

    @Test
    void run_shouldCopyNativeDocuments() throws Exception {
        remote.addNativeDocument(source, "Meeting notes");

        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess());
        assertTrue(remote.resolve(dest, "Meeting notes").get().isNativeDocument());
    }

    @Test
    void run_shouldCopyEditedNativeDocumentAgain() throws Exception {
        String doc = remote.addNativeDocument(source, "notes", 1024);
        assertTrue(engine(config(true, true)).run().isSuccess());

        remote.updateFile(doc, 2048, null);
        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess(), String.valueOf(result));
        assertEquals(1, result.getPlannedCopies());
        assertEquals(2048, remote.resolve(dest, "notes").get().getSize());
    }

    @Test
    void run_shouldCreateSkippedFolderChainWhileCopying() throws Exception {
        remote.addFileAt(source, "a/b/f.txt", 4, "h");
        remote.failNext(InMemoryRemoteService.CREATE_FOLDER, dest,
                new PermanentServiceException("Backend refused", 400, "badRequest", null));

        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess(), String.valueOf(result));
        assertEquals(Collections.singletonList("a/b"), result.getSkippedFolders());
        assertTrue(result.getFailedPaths().isEmpty());
        RemoteNode copy = remote.resolve(dest, "a/b/f.txt").orElseThrow(AssertionError::new);
        assertEquals("h", copy.getContentHash());
        assertTrue(result.getValidation().get().isPassed());
    }

    @Test
    void run_shouldRepairMissingFolderWhenAutoFixEnabled() throws Exception {
        remote.addFolder(source, "empty");
        remote.failNext(InMemoryRemoteService.CREATE_FOLDER, dest,
                new PermanentServiceException("Backend refused", 400, "badRequest", null));

        SyncResult result = engine(config(true, true)).run();

        assertTrue(result.isSuccess(), String.valueOf(result));
        assertTrue(remote.resolve(dest, "empty").isPresent());
        assertEquals(2, remote.getCallCount(InMemoryRemoteService.CREATE_FOLDER));
    }

    @Test
    void run_shouldFailValidationWhenAutoFixDisabled() throws Exception {
        remote.addFolder(source, "empty");
        remote.failNext(InMemoryRemoteService.CREATE_FOLDER, dest,
                new PermanentServiceException("Backend refused", 400, "badRequest", null));

        SyncResult result = engine(config(true, false)).run();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(1, result.getValidation().get().getDiscrepancies(DiscrepancyType.MISSING_FOLDER).size());
    }

    @Test
    void run_shouldSkipValidationWhenDisabled() throws Exception {
        remote.addFile(source, "a.txt", 1, "h");

        SyncResult result = engine(config(false, true)).run();

        assertTrue(result.isSuccess());
        assertFalse(result.getValidation().isPresent());
    }

    @Test
    void run_shouldReportEveryStateInOrder() throws Exception {
        remote.addFile(source, "a.txt", 1, "h");
        List<SyncState> states = new ArrayList<>();
        ProgressListener listener = new ProgressListener() {
            @Override
            public void onStateChange(SyncState state, ProgressCounters counters) {
                states.add(state);
            }
        };

        new SyncEngine(remote, TestGovernors.immediate(), new ResponseCache(), config(true, true), listener).run();

        assertEquals(Arrays.asList(SyncState.PREFLIGHT, SyncState.ENUMERATE_SOURCE, SyncState.ENUMERATE_DEST,
                SyncState.DIFF, SyncState.CREATE_FOLDERS, SyncState.COPY_FILES, SyncState.VALIDATE, SyncState.DONE), states);
    }

    private SyncEngine engine(Config config) {
        return new SyncEngine(remote, TestGovernors.immediate(), new ResponseCache(), config, ProgressListener.NONE);
    }

    private Config config(boolean finalValidation, boolean autoFix) throws Exception {
        return Config.fromJson("{"
                + "\"source\": {\"folderId\": \"" + source + "\"},"
                + "\"destination\": {\"folderId\": \"" + dest + "\"},"
                + "\"migration\": {\"batchSize\": 1, \"finalValidation\": " + finalValidation + ", \"autoFixMissing\": " + autoFix + "}"
                + "}");
    }
}
