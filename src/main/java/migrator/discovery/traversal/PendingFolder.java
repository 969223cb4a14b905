package migrator.discovery.traversal;

import java.util.Objects;

/**
 * A folder waiting to be listed during enumeration.
 */
public final class PendingFolder {
    private final String path;
    private final String folderId;

    public PendingFolder(String path, String folderId) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(folderId);
        this.path = path;
        this.folderId = folderId;
    }

    /**
     * @return Path relative to the enumerated root, empty for the root itself.
     */
    public String getPath() {
        return path;
    }

    public String getFolderId() {
        return folderId;
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    @Override
    public String toString() {
        return (isRoot() ? "<root>" : path) + " (" + folderId + ")";
    }
}
