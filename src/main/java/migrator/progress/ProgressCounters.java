package migrator.progress;

import migrator.sync.SyncState;

import java.util.Objects;

/**
 * Counters of a sync run. Only mutated through {@link #update(ProgressEvent)}, {@link #setTotals(int, int)} and
 * {@link #enterState(SyncState)}. Updates and state changes notify the {@link ProgressListener}, totals don't.
 * Thread-safe.
 */
public class ProgressCounters {
    private final ProgressListener listener;
    private int totalFiles;
    private int totalFolders;
    private int successfulCopies;
    private int failedCopies;
    private int skippedCopies;
    private int createdFolders;
    private int skippedFolders;
    private SyncState state = SyncState.INIT;

    public ProgressCounters(ProgressListener listener) {
        Objects.requireNonNull(listener);
        this.listener = listener;
    }

    public ProgressCounters() {
        this(ProgressListener.NONE);
    }

    public void update(ProgressEvent event) {
        synchronized (this) {
            switch (event) {
                case FILE_COPIED:
                    successfulCopies++;
                    break;
                case FILE_FAILED:
                    failedCopies++;
                    break;
                case FILE_SKIPPED:
                    skippedCopies++;
                    break;
                case FOLDER_CREATED:
                    createdFolders++;
                    break;
                case FOLDER_SKIPPED:
                    skippedFolders++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown event " + event);
            }
        }
        listener.onUpdate(this, event);
    }

    public void setTotals(int files, int folders) {
        synchronized (this) {
            this.totalFiles = files;
            this.totalFolders = folders;
        }
    }

    public void enterState(SyncState state) {
        synchronized (this) {
            this.state = state;
        }
        listener.onStateChange(state, this);
    }

    public synchronized int getTotalFiles() {
        return totalFiles;
    }

    public synchronized int getTotalFolders() {
        return totalFolders;
    }

    public synchronized int getSuccessfulCopies() {
        return successfulCopies;
    }

    public synchronized int getFailedCopies() {
        return failedCopies;
    }

    public synchronized int getSkippedCopies() {
        return skippedCopies;
    }

    public synchronized int getCreatedFolders() {
        return createdFolders;
    }

    public synchronized int getSkippedFolders() {
        return skippedFolders;
    }

    /**
     * @return Files copied, failed or skipped so far.
     */
    public synchronized int getProcessedFiles() {
        return successfulCopies + failedCopies + skippedCopies;
    }

    public synchronized SyncState getState() {
        return state;
    }

    @Override
    public synchronized String toString() {
        return "copied " + successfulCopies + ", failed " + failedCopies + ", skipped " + skippedCopies
                + " of " + totalFiles + " files; created " + createdFolders + ", skipped " + skippedFolders
                + " of " + totalFolders + " folders";
    }
}
