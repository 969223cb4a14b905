package migrator.sync;

/**
 * A snapshot contradicts itself or the destination, eg. a folder's parent is missing when it should have been created
 * already. Logged, and the affected item is skipped; never aborts a pass.
 */
public class InconsistentTreeException extends RuntimeException {
    private final String path;

    public InconsistentTreeException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
