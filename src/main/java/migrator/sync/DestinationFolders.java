package migrator.sync;

import migrator.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Relative path => ID of every known folder of the destination tree. Starts from the destination snapshot and learns
 * folders as they're created, so later lookups in the same pass see them immediately. Every access is serialized,
 * including creation through {@link #resolveOrCreate(String, FolderCreator)}, so a child never misses the ID of a
 * parent created by someone else.
 */
public class DestinationFolders {
    private final String rootId;
    private final Map<String, String> folders;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public DestinationFolders(String rootId, Map<String, String> knownFolders) {
        Objects.requireNonNull(rootId);
        this.rootId = rootId;
        this.folders = new HashMap<>(knownFolders);
    }

    public String getRootId() {
        return rootId;
    }

    /**
     * @param path  Relative path, empty for the root.
     * @return      The folder's ID, if known.
     */
    public synchronized Optional<String> resolve(String path) {
        return path.isEmpty() ? Optional.of(rootId) : Optional.ofNullable(folders.get(path));
    }

    public synchronized boolean contains(String path) {
        return path.isEmpty() || folders.containsKey(path);
    }

    public synchronized void put(String path, String folderId) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Can't remap the root folder");
        }
        folders.put(path, folderId);
    }

    public synchronized int size() {
        return folders.size();
    }

    /**
     * Walk down {@code path} segment by segment, creating any folder that isn't known yet.
     *
     * @param path      Relative path of the folder to resolve.
     * @param creator   Creates missing folders.
     * @return          The folder's ID, or empty if a missing folder couldn't be created.
     */
    public synchronized Optional<String> resolveOrCreate(String path, FolderCreator creator) {
        String currentId = rootId;
        String prefix = "";
        if (path.isEmpty()) {
            return Optional.of(currentId);
        }
        for (String segment : path.split(Util.PATH_SEPARATOR)) {
            prefix = Util.joinPath(prefix, segment);
            String id = folders.get(prefix);
            if (id == null) {
                logger.warn("Folder '{}' not known in destination, attempting creation", prefix);
                Optional<String> created = creator.create(segment, currentId);
                if (!created.isPresent()) {
                    logger.error("Unable to create or locate folder '{}' in destination", prefix);
                    return Optional.empty();
                }
                id = created.get();
                folders.put(prefix, id);
            }
            currentId = id;
        }
        return Optional.of(currentId);
    }
}
