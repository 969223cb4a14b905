package migrator.sync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DestinationFoldersTest {

    @Mock
    private FolderCreator creator;

    @Test
    void resolve_shouldMapEmptyPathToRoot() {
        DestinationFolders folders = new DestinationFolders("root", Collections.singletonMap("a", "idA"));

        assertEquals(Optional.of("root"), folders.resolve(""));
        assertEquals(Optional.of("idA"), folders.resolve("a"));
        assertEquals(Optional.empty(), folders.resolve("b"));
    }

    @Test
    void resolveOrCreate_shouldCreateOnlyMissingSegments() {
        DestinationFolders folders = new DestinationFolders("root", Collections.singletonMap("a", "idA"));
        when(creator.create("b", "idA")).thenReturn(Optional.of("idB"));
        when(creator.create("c", "idB")).thenReturn(Optional.of("idC"));

        assertEquals(Optional.of("idC"), folders.resolveOrCreate("a/b/c", creator));
        assertEquals(Optional.of("idB"), folders.resolve("a/b"));
        verify(creator, never()).create("a", "root");
    }

    @Test
    void resolveOrCreate_shouldFailWhenCreationFails() {
        DestinationFolders folders = new DestinationFolders("root", Collections.<String, String>emptyMap());
        when(creator.create("a", "root")).thenReturn(Optional.empty());

        assertEquals(Optional.empty(), folders.resolveOrCreate("a/b", creator));
        verify(creator, never()).create(eq("b"), anyString());
        assertFalse(folders.contains("a"));
    }

    @Test
    void put_shouldRejectRoot() {
        DestinationFolders folders = new DestinationFolders("root", Collections.<String, String>emptyMap());

        assertThrows(IllegalArgumentException.class, () -> folders.put("", "other"));
    }
}
