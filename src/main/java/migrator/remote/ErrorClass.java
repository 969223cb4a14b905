package migrator.remote;

/**
 * Classification of a remote failure, decided by the remote service adapter. Drives the retry decision of
 * {@link migrator.governor.RateGovernor}.
 */
public enum ErrorClass {
    /**
     * Service overload, rate limit or a momentary server fault. Worth retrying with backoff.
     */
    RETRIABLE,
    /**
     * Not found, invalid argument, permissions, quota exhausted for the day. Retrying won't help.
     */
    PERMANENT
}
