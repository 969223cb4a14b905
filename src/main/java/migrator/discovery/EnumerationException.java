package migrator.discovery;

/**
 * Thrown when a tree can't be enumerated at all, ie. its root can't be listed.
 */
public class EnumerationException extends Exception {

    public EnumerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
