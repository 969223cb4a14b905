package migrator.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-bounded memo of remote query results, keyed by the {@link CacheKeys logical query}. One instance is shared by
 * the whole process.
 * <p>
 * Entries expire {@link #DEFAULT_TTL 30 minutes} after being set. There is no background eviction: an expired entry is
 * removed by the {@link #get(String, Class)} that finds it. The cache never notices changes made to the remote store,
 * callers must {@link #remove(String)} the keys they know are stale.
 */
public class ResponseCache {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration ttl;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public ResponseCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl);
        Objects.requireNonNull(clock);
        this.ttl = ttl;
        this.clock = clock;
    }

    public ResponseCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    /**
     * Get a cached value.
     *
     * @param key   Cache key.
     * @param type  Expected type of the value.
     * @param <T>   Expected type of the value.
     * @return      The value, or empty if it was never set, was removed or has expired.
     * @throws ClassCastException If the cached value is not of the expected type.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (Duration.between(entry.timestamp, clock.instant()).compareTo(ttl) >= 0) {
                entries.remove(key);
                logger.trace("Evicted expired entry {}", key);
                return Optional.empty();
            }
            return Optional.of(type.cast(entry.value));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value, replacing any previous value for the same key and restarting its time to live.
     */
    public void set(String key, Object value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value, "Can't cache null values, remove the key instead");
        lock.lock();
        try {
            entries.put(key, new Entry(value, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove an entry, if present.
     */
    public void remove(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return Number of stored entries, including expired entries that haven't been evicted yet.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry {
        private final Object value;
        private final Instant timestamp;

        private Entry(Object value, Instant timestamp) {
            this.value = value;
            this.timestamp = timestamp;
        }
    }
}
