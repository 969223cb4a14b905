package migrator.progress;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LoggingProgressListenerTest {

    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LoggingProgressListener.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    @Test
    void onUpdate_shouldLogOnceEveryIntervalOfFiles() {
        ProgressCounters counters = new ProgressCounters(new LoggingProgressListener(2));

        counters.update(ProgressEvent.FILE_COPIED);
        counters.update(ProgressEvent.FILE_SKIPPED);
        counters.update(ProgressEvent.FILE_FAILED);
        counters.update(ProgressEvent.FILE_COPIED);
        counters.update(ProgressEvent.FILE_COPIED);

        assertEquals(2, progressLines().size());
    }

    @Test
    void onUpdate_shouldIgnoreFolderEvents() {
        ProgressCounters counters = new ProgressCounters(new LoggingProgressListener(1));

        counters.update(ProgressEvent.FOLDER_CREATED);
        counters.update(ProgressEvent.FOLDER_CREATED);

        assertTrue(progressLines().isEmpty());
    }

    private List<String> progressLines() {
        return appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .filter(message -> message.startsWith("Progress"))
                .collect(Collectors.toList());
    }
}
