package migrator.discovery;

import migrator.Util;
import migrator.remote.RemoteNode;

import java.util.Objects;

/**
 * Metadata of a file in a {@link TreeSnapshot}.
 */
public final class FileEntry {
    private final String id;
    private final long size;
    private final String contentHash;
    private final String mimeType;

    public FileEntry(String id, long size, String contentHash, String mimeType) {
        Objects.requireNonNull(id);
        this.id = id;
        this.size = size;
        this.contentHash = contentHash;
        this.mimeType = mimeType;
    }

    public static FileEntry of(RemoteNode file) {
        return new FileEntry(file.getId(), file.getSize(), file.getContentHash(), file.getMimeType());
    }

    public String getId() {
        return id;
    }

    public long getSize() {
        return size;
    }

    /**
     * @return MD5 of the content, may be {@code null}.
     */
    public String getContentHash() {
        return contentHash;
    }

    public String getMimeType() {
        return mimeType;
    }

    public boolean isNativeDocument() {
        return Util.isNativeDocument(mimeType);
    }

    /**
     * Whether both entries have a content hash and they differ. Unknown hashes never count as different.
     */
    public boolean hashDiffers(FileEntry other) {
        return contentHash != null && other.contentHash != null && !contentHash.equals(other.contentHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileEntry fileEntry = (FileEntry) o;
        return size == fileEntry.size &&
                Objects.equals(id, fileEntry.id) &&
                Objects.equals(contentHash, fileEntry.contentHash) &&
                Objects.equals(mimeType, fileEntry.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, size, contentHash, mimeType);
    }

    @Override
    public String toString() {
        return id + " (" + size + " bytes, md5 " + contentHash + ")";
    }
}
