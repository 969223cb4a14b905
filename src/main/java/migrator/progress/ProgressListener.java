package migrator.progress;

import migrator.sync.SyncState;

/**
 * Receives every counter update and state transition of a sync run, eg. to render progress.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    /**
     * Called after {@code counters} were updated.
     */
    default void onUpdate(ProgressCounters counters, ProgressEvent event) {
    }

    /**
     * Called when the sync engine enters a new state.
     */
    default void onStateChange(SyncState state, ProgressCounters counters) {
    }
}
