package migrator.diff;

import java.util.Objects;

/**
 * A source file to copy to the same relative path in the destination tree.
 */
public final class PlannedCopy {
    private final String sourceFileId;
    private final String relativePath;

    public PlannedCopy(String sourceFileId, String relativePath) {
        Objects.requireNonNull(sourceFileId);
        Objects.requireNonNull(relativePath);
        this.sourceFileId = sourceFileId;
        this.relativePath = relativePath;
    }

    public String getSourceFileId() {
        return sourceFileId;
    }

    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlannedCopy that = (PlannedCopy) o;
        return sourceFileId.equals(that.sourceFileId) && relativePath.equals(that.relativePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceFileId, relativePath);
    }

    @Override
    public String toString() {
        return relativePath + " (" + sourceFileId + ")";
    }
}
