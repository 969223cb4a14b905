package migrator.remote;

/**
 * A remote failure that won't be fixed by retrying. Surfaced immediately.
 */
public class PermanentServiceException extends RemoteServiceException {

    public PermanentServiceException(String message, int statusCode, String reason, Throwable cause) {
        super(message, statusCode, reason, cause);
    }

    public PermanentServiceException(String message, Throwable cause) {
        this(message, NO_STATUS, null, cause);
    }

    public PermanentServiceException(String message) {
        this(message, null);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.PERMANENT;
    }
}
