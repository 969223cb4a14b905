package migrator.remote;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns the exceptions thrown by the Drive client into classified {@link RemoteServiceException}s.
 *
 * @see <a href="https://developers.google.com/drive/api/guides/handle-errors">Drive error reference</a>
 */
public final class DriveErrors {
    private static final Set<Integer> RETRIABLE_STATUSES = new HashSet<>(Arrays.asList(429, 500, 502, 503, 504));

    /**
     * 403 is mostly sent for rate limiting, but these reasons mean the request will never succeed.
     */
    private static final Set<String> PERMANENT_403_REASONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "dailyLimitExceeded",
            "insufficientFilePermissions",
            "insufficientPermissions",
            "domainPolicy",
            "cannotCopyFile",
            "storageQuotaExceeded",
            "teamDriveFileLimitExceeded"
    )));

    private DriveErrors() {
    }

    /**
     * Classify a failed request by its status code and reason.
     *
     * @param statusCode    HTTP status, or {@link RemoteServiceException#NO_STATUS} if the request never got a response.
     * @param reason        Reason reported by Drive, may be {@code null}.
     * @return              The error class.
     */
    public static ErrorClass classify(int statusCode, String reason) {
        if (statusCode == RemoteServiceException.NO_STATUS || RETRIABLE_STATUSES.contains(statusCode)) {
            return ErrorClass.RETRIABLE;
        }
        if (statusCode == 403) {
            return PERMANENT_403_REASONS.contains(reason) ? ErrorClass.PERMANENT : ErrorClass.RETRIABLE;
        }
        return ErrorClass.PERMANENT;
    }

    /**
     * Wrap an exception thrown by the Drive client.
     *
     * @param operation Short description of the failed operation, for the message.
     * @param e         The exception.
     * @return          The classified exception, to be thrown by the caller.
     */
    public static RemoteServiceException wrap(String operation, IOException e) {
        int status = RemoteServiceException.NO_STATUS;
        String reason = null;
        if (e instanceof HttpResponseException) {
            status = ((HttpResponseException) e).getStatusCode();
        }
        if (e instanceof GoogleJsonResponseException) {
            GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
            if (details != null && details.getErrors() != null && !details.getErrors().isEmpty()) {
                reason = details.getErrors().get(0).getReason();
            }
        }
        String message = operation + " failed" + (status == RemoteServiceException.NO_STATUS ? "" : " with status " + status)
                + (reason == null ? "" : " (" + reason + ")") + ": " + e.getMessage();
        if (classify(status, reason) == ErrorClass.RETRIABLE) {
            return new TransientServiceException(message, status, reason, e);
        } else {
            return new PermanentServiceException(message, status, reason, e);
        }
    }
}
