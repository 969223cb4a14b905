package migrator.sync;

public enum CopyOutcome {
    COPIED,
    /**
     * An identical file was already at the destination.
     */
    SKIPPED,
    FAILED;

    public boolean isSuccessful() {
        return this != FAILED;
    }
}
