package migrator.progress;

import migrator.sync.SyncState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs state transitions, and a progress line every {@code every} processed files.
 */
public class LoggingProgressListener implements ProgressListener {
    private final int every;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public LoggingProgressListener(int every) {
        if (every <= 0) {
            throw new IllegalArgumentException("Must log every 1 or more files, got " + every);
        }
        this.every = every;
    }

    @Override
    public void onUpdate(ProgressCounters counters, ProgressEvent event) {
        int processed = counters.getProcessedFiles();
        boolean fileEvent = event == ProgressEvent.FILE_COPIED || event == ProgressEvent.FILE_FAILED || event == ProgressEvent.FILE_SKIPPED;
        if (fileEvent && processed % every == 0) {
            logger.info("Progress: {}", counters);
        }
    }

    @Override
    public void onStateChange(SyncState state, ProgressCounters counters) {
        logger.info("Entering {} ({})", state, counters);
    }
}
