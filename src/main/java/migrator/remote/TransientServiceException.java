package migrator.remote;

/**
 * A remote failure expected to go away on its own. Retried by the rate governor.
 */
public class TransientServiceException extends RemoteServiceException {

    public TransientServiceException(String message, int statusCode, String reason, Throwable cause) {
        super(message, statusCode, reason, cause);
    }

    public TransientServiceException(String message, Throwable cause) {
        this(message, NO_STATUS, null, cause);
    }

    public TransientServiceException(String message) {
        this(message, null);
    }

    @Override
    public ErrorClass getErrorClass() {
        return ErrorClass.RETRIABLE;
    }
}
