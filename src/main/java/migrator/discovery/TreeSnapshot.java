package migrator.discovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time enumeration of the tree rooted at a remote folder. Maps relative paths (see {@link migrator.Util}) to
 * file metadata and, separately, to folder IDs. Every ancestor folder of a file path is a key of {@link #getFolders()};
 * the root itself is the empty path and is implicit.
 * <p>
 * Immutable. A new pass produces a new snapshot rather than patching an old one.
 */
public final class TreeSnapshot {
    private final String rootId;
    private final Map<String, FileEntry> files;
    private final Map<String, String> folders;
    private final Set<String> incompletePaths;

    public TreeSnapshot(String rootId, Map<String, FileEntry> files, Map<String, String> folders, Set<String> incompletePaths) {
        this.rootId = rootId;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.folders = Collections.unmodifiableMap(new LinkedHashMap<>(folders));
        this.incompletePaths = Collections.unmodifiableSet(new LinkedHashSet<>(incompletePaths));
    }

    public TreeSnapshot(String rootId, Map<String, FileEntry> files, Map<String, String> folders) {
        this(rootId, files, folders, Collections.<String>emptySet());
    }

    public String getRootId() {
        return rootId;
    }

    public Map<String, FileEntry> getFiles() {
        return files;
    }

    public Map<String, String> getFolders() {
        return folders;
    }

    /**
     * @return Paths of the folders whose listing failed. Their subtrees are under-populated, so files missing from them
     *         may not actually be missing.
     */
    public Set<String> getIncompletePaths() {
        return incompletePaths;
    }

    public boolean isComplete() {
        return incompletePaths.isEmpty();
    }

    public int getItemCount() {
        return files.size() + folders.size();
    }

    public long getTotalSize() {
        long total = 0;
        for (FileEntry file : files.values()) {
            total += file.getSize();
        }
        return total;
    }

    @Override
    public String toString() {
        return "TreeSnapshot{" + rootId + ": " + files.size() + " files, " + folders.size() + " folders"
                + (isComplete() ? "" : ", " + incompletePaths.size() + " incomplete") + "}";
    }
}
