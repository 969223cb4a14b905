package migrator.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The files to copy to bring a destination tree up to date with a source tree. Consumed once, by the copy pass.
 */
public final class DiffPlan implements Iterable<PlannedCopy> {
    private final List<PlannedCopy> copies;

    public DiffPlan(List<PlannedCopy> copies) {
        this.copies = Collections.unmodifiableList(new ArrayList<>(copies));
    }

    public List<PlannedCopy> getCopies() {
        return copies;
    }

    public int size() {
        return copies.size();
    }

    public boolean isEmpty() {
        return copies.isEmpty();
    }

    public boolean containsPath(String relativePath) {
        return copies.stream().anyMatch(copy -> copy.getRelativePath().equals(relativePath));
    }

    @Override
    public Iterator<PlannedCopy> iterator() {
        return copies.iterator();
    }
}
