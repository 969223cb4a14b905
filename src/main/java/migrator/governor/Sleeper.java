package migrator.governor;

/**
 * Puts the calling thread to sleep. Replaced in tests to avoid actually waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEPER = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
