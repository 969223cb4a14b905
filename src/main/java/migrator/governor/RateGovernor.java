package migrator.governor;

import migrator.remote.PermanentServiceException;
import migrator.remote.RemoteServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Throttles and retries every request sent to the remote service. There must be exactly one instance per process,
 * shared by every component, so that the request budget is global.
 * <p>
 * Throttling keeps a sliding window of the timestamps of admitted requests. A request is only admitted if, counting it,
 * there would be at most {@code rateLimit} requests in the trailing {@code timeWindow}; otherwise the caller sleeps
 * until the oldest request leaves the window. Requests are never dropped.
 * <p>
 * Retriable failures are retried with truncated exponential backoff plus up to one second of random jitter.
 *
 * @see <a href="https://developers.google.com/drive/api/guides/limits">Drive usage limits</a>
 */
public class RateGovernor {
    public static final int DEFAULT_RATE_LIMIT = 1000;
    public static final int DEFAULT_TIME_WINDOW_SECONDS = 60;
    public static final int DEFAULT_MAX_RETRIES = 10;
    static final double BASE_DELAY_SECONDS = 1.0;
    static final double MAX_BACKOFF_SECONDS = 64.0;

    private final int rateLimit;
    private final long timeWindowMillis;
    private final int maxRetries;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;
    private final Deque<Long> window = new ArrayDeque<>();
    private final ReentrantLock windowLock = new ReentrantLock(true);
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public RateGovernor(int rateLimit, int timeWindowSeconds, int maxRetries, Clock clock, Sleeper sleeper, DoubleSupplier jitter) {
        if (rateLimit <= 0) {
            throw new IllegalArgumentException("Rate limit must be positive, got " + rateLimit);
        }
        if (timeWindowSeconds <= 0) {
            throw new IllegalArgumentException("Time window must be positive, got " + timeWindowSeconds);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries can't be negative, got " + maxRetries);
        }
        this.rateLimit = rateLimit;
        this.timeWindowMillis = timeWindowSeconds * 1000L;
        this.maxRetries = maxRetries;
        this.clock = clock;
        this.sleeper = sleeper;
        this.jitter = jitter;
        logger.info("Rate governor configured: {} requests per {}s, up to {} retries", rateLimit, timeWindowSeconds, maxRetries);
    }

    /**
     * Convenience constructor. Uses the system clock, real sleeps and random jitter.
     */
    public RateGovernor(int rateLimit, int timeWindowSeconds, int maxRetries) {
        this(rateLimit, timeWindowSeconds, maxRetries, Clock.systemUTC(), Sleeper.THREAD_SLEEPER, new Random()::nextDouble);
    }

    /**
     * Convenience constructor with the default limits, 1000 requests per minute and 10 retries.
     */
    public RateGovernor() {
        this(DEFAULT_RATE_LIMIT, DEFAULT_TIME_WINDOW_SECONDS, DEFAULT_MAX_RETRIES);
    }

    /**
     * Block until one more request fits in the budget, then record it.
     *
     * @throws InterruptedException If interrupted while waiting.
     */
    public void admit() throws InterruptedException {
        windowLock.lock();
        try {
            long now = clock.millis();
            prune(now);
            while (window.size() >= rateLimit) {
                long sleepMillis = timeWindowMillis - (now - window.peekFirst());
                if (sleepMillis > 0) {
                    logger.debug("Rate limit reached, sleeping {}ms to comply", sleepMillis);
                    sleeper.sleep(sleepMillis);
                }
                now = clock.millis();
                prune(now);
            }
            window.addLast(now);
        } finally {
            windowLock.unlock();
        }
    }

    /**
     * Run a remote call through the governor: wait for admission, execute, and retry retriable failures with backoff.
     * Permanent failures are rethrown right away.
     *
     * @param call  The call.
     * @param <T>   The call's result type.
     * @return      The call's result.
     * @throws RemoteServiceException The call's last failure, if it failed permanently or {@code maxRetries} times in
     *                                a row. Interruption while waiting is reported as a permanent failure.
     */
    public <T> T executeWithRetry(RemoteCall<T> call) throws RemoteServiceException {
        int retries = 0;
        while (true) {
            try {
                admit();
                return call.execute();
            } catch (RemoteServiceException e) {
                if (!e.isRetriable()) {
                    throw e;
                }
                if (retries >= maxRetries) {
                    logger.error("Max retries ({}) reached, giving up: {}", maxRetries, e.getMessage());
                    throw e;
                }
                long sleepMillis = backoffMillis(retries);
                retries++;
                logger.warn("Request failed with status {}. Retry {}/{} in {}ms. Error: {}",
                        e.getStatusCode(), retries, maxRetries, sleepMillis, e.getMessage());
                try {
                    sleeper.sleep(sleepMillis);
                } catch (InterruptedException interrupted) {
                    throw interruption(interrupted);
                }
            } catch (InterruptedException e) {
                throw interruption(e);
            }
        }
    }

    /**
     * Backoff before the retry following the {@code retries}-th one: {@code min(base * 2^retries, max) + jitter}.
     */
    long backoffMillis(int retries) {
        double delaySeconds = Math.min(BASE_DELAY_SECONDS * Math.pow(2, retries), MAX_BACKOFF_SECONDS);
        return Math.round((delaySeconds + jitter.getAsDouble()) * 1000);
    }

    /**
     * @return How many requests are in the current window. Prunes expired requests first.
     */
    public int getWindowSize() {
        windowLock.lock();
        try {
            prune(clock.millis());
            return window.size();
        } finally {
            windowLock.unlock();
        }
    }

    public int getRateLimit() {
        return rateLimit;
    }

    public long getTimeWindowMillis() {
        return timeWindowMillis;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private void prune(long now) {
        while (!window.isEmpty() && now - window.peekFirst() >= timeWindowMillis) {
            window.removeFirst();
        }
    }

    private RemoteServiceException interruption(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new PermanentServiceException("Interrupted while waiting to send a request", e);
    }
}
