package migrator.progress;

import migrator.sync.SyncState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCountersTest {

    @Test
    void update_shouldCountEachEventAndNotifyListener() {
        List<ProgressEvent> events = new ArrayList<>();
        ProgressCounters counters = new ProgressCounters(new ProgressListener() {
            @Override
            public void onUpdate(ProgressCounters counters, ProgressEvent event) {
                events.add(event);
            }
        });

        counters.setTotals(3, 1);
        counters.update(ProgressEvent.FILE_COPIED);
        counters.update(ProgressEvent.FILE_SKIPPED);
        counters.update(ProgressEvent.FILE_FAILED);
        counters.update(ProgressEvent.FOLDER_CREATED);

        assertEquals(3, counters.getProcessedFiles());
        assertEquals(1, counters.getSuccessfulCopies());
        assertEquals(1, counters.getSkippedCopies());
        assertEquals(1, counters.getFailedCopies());
        assertEquals(1, counters.getCreatedFolders());
        assertEquals(3, counters.getTotalFiles());
        assertEquals(4, events.size());
    }

    @Test
    void setTotals_shouldRecordTotalsWithoutNotifyingListener() {
        List<ProgressEvent> events = new ArrayList<>();
        ProgressCounters counters = new ProgressCounters(new ProgressListener() {
            @Override
            public void onUpdate(ProgressCounters counters, ProgressEvent event) {
                events.add(event);
            }
        });

        counters.setTotals(7, 2);

        assertEquals(7, counters.getTotalFiles());
        assertEquals(2, counters.getTotalFolders());
        assertTrue(events.isEmpty());
    }

    @Test
    void enterState_shouldRecordState() {
        ProgressCounters counters = new ProgressCounters();

        counters.enterState(SyncState.COPY_FILES);

        assertEquals(SyncState.COPY_FILES, counters.getState());
    }

    @Test
    void loggingListener_shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new LoggingProgressListener(0));
    }
}
