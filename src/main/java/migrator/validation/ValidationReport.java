package migrator.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a {@link Validator} run. Passed when no discrepancy was found.
 */
public class ValidationReport {
    private final List<Discrepancy> discrepancies;
    private final int checkedFiles;
    private final int checkedFolders;

    public ValidationReport(List<Discrepancy> discrepancies, int checkedFiles, int checkedFolders) {
        this.discrepancies = Collections.unmodifiableList(new ArrayList<>(discrepancies));
        this.checkedFiles = checkedFiles;
        this.checkedFolders = checkedFolders;
    }

    public boolean isPassed() {
        return discrepancies.isEmpty();
    }

    public List<Discrepancy> getDiscrepancies() {
        return discrepancies;
    }

    public List<Discrepancy> getDiscrepancies(DiscrepancyType type) {
        return discrepancies.stream().filter(d -> d.getType() == type).collect(Collectors.toList());
    }

    /**
     * @return Whether some source item is absent from the destination, which another copy pass could fix.
     */
    public boolean hasMissingItems() {
        return discrepancies.stream().anyMatch(d -> d.getType() == DiscrepancyType.MISSING_FILE
                || d.getType() == DiscrepancyType.MISSING_FOLDER);
    }

    /**
     * @return Number of source files checked.
     */
    public int getCheckedFiles() {
        return checkedFiles;
    }

    /**
     * @return Number of source folders checked.
     */
    public int getCheckedFolders() {
        return checkedFolders;
    }

    @Override
    public String toString() {
        return (isPassed() ? "Passed" : "Failed with " + discrepancies.size() + " discrepancies")
                + " (" + checkedFiles + " files, " + checkedFolders + " folders checked)";
    }
}
