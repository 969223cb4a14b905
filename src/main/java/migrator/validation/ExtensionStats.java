package migrator.validation;

/**
 * Number and total size of the source files sharing an extension.
 */
public class ExtensionStats {
    public static final String NO_EXTENSION = "no_extension";

    private final String extension;
    private int count;
    private long totalSize;

    public ExtensionStats(String extension) {
        this.extension = extension;
    }

    void add(long size) {
        count++;
        totalSize += size;
    }

    public String getExtension() {
        return extension;
    }

    public int getCount() {
        return count;
    }

    public long getTotalSize() {
        return totalSize;
    }

    @Override
    public String toString() {
        return "." + extension + ": " + count + " files, " + totalSize + " bytes";
    }
}
