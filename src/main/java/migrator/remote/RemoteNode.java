package migrator.remote;

import migrator.Util;

import java.util.Objects;

/**
 * Snapshot of a remote file or folder, as returned by the remote service at the time of the request. Never mutated
 * locally, only re-fetched.
 */
public final class RemoteNode {
    private final String id;
    private final String name;
    private final NodeKind kind;
    private final String mimeType;
    private final long size;
    private final String contentHash;

    public RemoteNode(String id, String name, NodeKind kind, String mimeType, long size, String contentHash) {
        Objects.requireNonNull(id, "Remote ID may not be null");
        Objects.requireNonNull(name, "Name may not be null");
        Objects.requireNonNull(kind, "Kind may not be null");
        if (size < 0) {
            throw new IllegalArgumentException("Size of " + name + " can't be negative: " + size);
        }
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.mimeType = mimeType;
        this.size = size;
        this.contentHash = contentHash;
    }

    public static RemoteNode folder(String id, String name) {
        return new RemoteNode(id, name, NodeKind.FOLDER, Util.FOLDER_MIME_TYPE, 0, null);
    }

    public static RemoteNode file(String id, String name, String mimeType, long size, String contentHash) {
        return new RemoteNode(id, name, NodeKind.FILE, mimeType, size, contentHash);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isFolder() {
        return kind == NodeKind.FOLDER;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * @return Size in bytes. {@code 0} for folders and for native documents, which Drive doesn't report a size for.
     */
    public long getSize() {
        return size;
    }

    /**
     * @return MD5 of the content, or {@code null} when the service doesn't have one (eg. native documents).
     */
    public String getContentHash() {
        return contentHash;
    }

    /**
     * @see Util#isNativeDocument(String)
     */
    public boolean isNativeDocument() {
        return kind == NodeKind.FILE && Util.isNativeDocument(mimeType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RemoteNode that = (RemoteNode) o;
        return size == that.size &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(mimeType, that.mimeType) &&
                Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, mimeType, size, contentHash);
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
