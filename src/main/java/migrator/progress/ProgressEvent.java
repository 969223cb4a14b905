package migrator.progress;

/**
 * Per-item outcomes counted by {@link ProgressCounters}.
 */
public enum ProgressEvent {
    FILE_COPIED,
    FILE_FAILED,
    FILE_SKIPPED,
    FOLDER_CREATED,
    FOLDER_SKIPPED
}
