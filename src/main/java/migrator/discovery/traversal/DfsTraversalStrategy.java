package migrator.discovery.traversal;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * DFS traversal over an explicit stack, so depth is not bounded by the call stack.
 */
public class DfsTraversalStrategy implements TraversalStrategy {
    protected final Deque<PendingFolder> deque = new ArrayDeque<>();

    public DfsTraversalStrategy(PendingFolder root) {
        deque.addFirst(root);
    }

    @Override
    public boolean isDone() {
        return deque.isEmpty();
    }

    @Override
    public PendingFolder next() throws IllegalStateException {
        checkNotDone();
        return deque.removeFirst();
    }

    @Override
    public void add(PendingFolder folder) {
        deque.addFirst(folder);
    }
}
