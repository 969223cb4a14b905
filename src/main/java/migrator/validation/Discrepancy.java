package migrator.validation;

import java.util.Objects;

/**
 * A difference found between a source tree and its destination, keyed by relative path.
 */
public final class Discrepancy {
    public static final long UNKNOWN_SIZE = -1;

    private final DiscrepancyType type;
    private final String path;
    private final long sourceSize;
    private final long destSize;

    public Discrepancy(DiscrepancyType type, String path, long sourceSize, long destSize) {
        Objects.requireNonNull(type);
        Objects.requireNonNull(path);
        this.type = type;
        this.path = path;
        this.sourceSize = sourceSize;
        this.destSize = destSize;
    }

    public static Discrepancy missingFile(String path, long sourceSize) {
        return new Discrepancy(DiscrepancyType.MISSING_FILE, path, sourceSize, UNKNOWN_SIZE);
    }

    public static Discrepancy sizeMismatch(String path, long sourceSize, long destSize) {
        return new Discrepancy(DiscrepancyType.SIZE_MISMATCH, path, sourceSize, destSize);
    }

    public static Discrepancy hashMismatch(String path, long size) {
        return new Discrepancy(DiscrepancyType.HASH_MISMATCH, path, size, size);
    }

    public static Discrepancy missingFolder(String path) {
        return new Discrepancy(DiscrepancyType.MISSING_FOLDER, path, UNKNOWN_SIZE, UNKNOWN_SIZE);
    }

    public static Discrepancy extraFolder(String path) {
        return new Discrepancy(DiscrepancyType.EXTRA_FOLDER, path, UNKNOWN_SIZE, UNKNOWN_SIZE);
    }

    public DiscrepancyType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return Size of the source file, {@link #UNKNOWN_SIZE} for folders.
     */
    public long getSourceSize() {
        return sourceSize;
    }

    /**
     * @return Size of the destination file, {@link #UNKNOWN_SIZE} for folders and missing files.
     */
    public long getDestSize() {
        return destSize;
    }

    /**
     * @return A human-readable description, suitable for logging.
     */
    public String getMessage() {
        switch (type) {
            case MISSING_FILE:
                return "Missing file in destination: " + path;
            case SIZE_MISMATCH:
                return "Size mismatch for " + path + ": src=" + sourceSize + ", dest=" + destSize;
            case HASH_MISMATCH:
                return "MD5 mismatch for " + path;
            case MISSING_FOLDER:
                return "Missing folder in destination: " + path;
            case EXTRA_FOLDER:
                return "Extra folder in destination: " + path;
            default:
                throw new IllegalStateException("Unknown discrepancy type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Discrepancy that = (Discrepancy) o;
        return sourceSize == that.sourceSize &&
                destSize == that.destSize &&
                type == that.type &&
                Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, sourceSize, destSize);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
