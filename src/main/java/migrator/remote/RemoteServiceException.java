package migrator.remote;

/**
 * Failure of a call to the remote service. Every failure carries an {@link ErrorClass}, so callers never have to
 * inspect status codes themselves.
 */
public abstract class RemoteServiceException extends Exception {
    /**
     * Status code used when the failure didn't come from an HTTP response (eg. socket timeout).
     */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String reason;

    protected RemoteServiceException(String message, int statusCode, String reason, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public abstract ErrorClass getErrorClass();

    public boolean isRetriable() {
        return getErrorClass() == ErrorClass.RETRIABLE;
    }

    /**
     * @return The HTTP status code of the failed request, or {@link #NO_STATUS}.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return The service's reason for the failure (eg. {@code userRateLimitExceeded}), or {@code null} if unknown.
     */
    public String getReason() {
        return reason;
    }
}
