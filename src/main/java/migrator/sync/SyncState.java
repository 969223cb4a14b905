package migrator.sync;

/**
 * States of a {@link SyncEngine} run, in order. {@link #FAILED} can be reached from any state.
 */
public enum SyncState {
    INIT,
    PREFLIGHT,
    ENUMERATE_SOURCE,
    ENUMERATE_DEST,
    DIFF,
    CREATE_FOLDERS,
    COPY_FILES,
    VALIDATE,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
