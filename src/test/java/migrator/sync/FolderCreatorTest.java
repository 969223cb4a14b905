package migrator.sync;

import migrator.TestGovernors;
import migrator.cache.CacheKeys;
import migrator.cache.ResponseCache;
import migrator.progress.ProgressCounters;
import migrator.remote.NodeKind;
import migrator.remote.PermanentServiceException;
import migrator.remote.RemoteNode;
import migrator.remote.RemoteService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FolderCreatorTest {

    @Mock
    private RemoteService remote;

    private ResponseCache cache;
    private ProgressCounters counters;
    private FolderCreator creator;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache();
        counters = new ProgressCounters();
        creator = new FolderCreator(remote, TestGovernors.immediate(), cache, counters);
    }

    @Test
    void create_shouldReuseExistingFolder() throws Exception {
        when(remote.findByName("parent", "docs", NodeKind.FOLDER)).thenReturn(Optional.of(RemoteNode.folder("existing", "docs")));

        assertEquals(Optional.of("existing"), creator.create("docs", "parent"));
        verify(remote, never()).createFolder(anyString(), anyString());
        assertEquals(1, counters.getSkippedFolders());
        assertEquals(Optional.of("existing"), cache.get(CacheKeys.folderByName("parent", "docs"), String.class));
    }

    @Test
    void create_shouldCreateAndVerifyNewFolder() throws Exception {
        when(remote.findByName("parent", "docs", NodeKind.FOLDER)).thenReturn(Optional.empty());
        when(remote.createFolder("docs", "parent")).thenReturn("new");
        when(remote.getMetadata("new")).thenReturn(Optional.of(RemoteNode.folder("new", "docs")));

        assertEquals(Optional.of("new"), creator.create("docs", "parent"));
        assertEquals(1, counters.getCreatedFolders());
    }

    @Test
    void create_shouldReturnEmptyWhenCreationFails() throws Exception {
        when(remote.findByName("parent", "docs", NodeKind.FOLDER)).thenReturn(Optional.empty());
        when(remote.createFolder("docs", "parent")).thenThrow(new PermanentServiceException("Forbidden", 403, "insufficientFilePermissions", null));

        assertEquals(Optional.empty(), creator.create("docs", "parent"));
        assertEquals(0, counters.getCreatedFolders());
    }

    @Test
    void create_shouldReturnEmptyWhenNewFolderCannotBeFound() throws Exception {
        when(remote.findByName("parent", "docs", NodeKind.FOLDER)).thenReturn(Optional.empty());
        when(remote.createFolder("docs", "parent")).thenReturn("new");
        when(remote.getMetadata("new")).thenReturn(Optional.empty());

        assertEquals(Optional.empty(), creator.create("docs", "parent"));
    }
}
