package migrator.discovery.traversal;

/**
 * Interface to determine the order in which folders are listed during enumeration.
 */
public interface TraversalStrategy {

    /**
     * Whether traversal is complete.
     *
     * @return Whether traversal is complete.
     */
    boolean isDone();

    /**
     * Get the next folder to list.
     *
     * @return The next folder.
     * @throws IllegalStateException If {@code isDone()}.
     */
    PendingFolder next() throws IllegalStateException;

    /**
     * Add a folder to be traversed.
     *
     * @param folder The folder to add.
     */
    void add(PendingFolder folder);

    /**
     * Checks that traversal is not complete. Convenience method to be called as the first line of {@link #next()}.
     *
     * @throws IllegalStateException If done.
     */
    default void checkNotDone() throws IllegalStateException {
        if (isDone()) {
            throw new IllegalStateException(getClass().getSimpleName() + " traversal is already done, no folders left");
        }
    }
}
