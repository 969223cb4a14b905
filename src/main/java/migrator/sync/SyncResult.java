package migrator.sync;

import migrator.progress.ProgressCounters;
import migrator.validation.ValidationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a {@link SyncEngine} run. Successful only if the run reached {@link SyncState#DONE}: no copy failed and,
 * when enabled, validation found no discrepancy. Partial success is a failure.
 */
public class SyncResult {
    private final ProgressCounters counters;
    private final List<String> failedPaths = new ArrayList<>();
    private final List<String> skippedFolders = new ArrayList<>();
    private SyncState state = SyncState.INIT;
    private int plannedCopies;
    private int missingFolders;
    private ValidationReport validation;
    private String failureReason;

    SyncResult(ProgressCounters counters) {
        this.counters = counters;
    }

    public boolean isSuccess() {
        return state == SyncState.DONE;
    }

    public SyncState getState() {
        return state;
    }

    void setState(SyncState state) {
        this.state = state;
    }

    public ProgressCounters getCounters() {
        return counters;
    }

    /**
     * @return Number of files the last diff planned to copy.
     */
    public int getPlannedCopies() {
        return plannedCopies;
    }

    void setPlannedCopies(int plannedCopies) {
        this.plannedCopies = plannedCopies;
    }

    /**
     * @return Number of folders the last diff found missing in the destination.
     */
    public int getMissingFolders() {
        return missingFolders;
    }

    void setMissingFolders(int missingFolders) {
        this.missingFolders = missingFolders;
    }

    /**
     * @return Relative paths of the files that couldn't be copied.
     */
    public List<String> getFailedPaths() {
        return Collections.unmodifiableList(failedPaths);
    }

    void addFailedPath(String path) {
        failedPaths.add(path);
    }

    /**
     * @return Relative paths of the folders skipped because their parent couldn't be found.
     */
    public List<String> getSkippedFolders() {
        return Collections.unmodifiableList(skippedFolders);
    }

    void addSkippedFolder(String path) {
        skippedFolders.add(path);
    }

    /**
     * @return The final validation report, if validation ran.
     */
    public Optional<ValidationReport> getValidation() {
        return Optional.ofNullable(validation);
    }

    void setValidation(ValidationReport validation) {
        this.validation = validation;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    @Override
    public String toString() {
        return state + ": " + plannedCopies + " planned copies, " + missingFolders + " missing folders; " + counters
                + (failureReason == null ? "" : " (" + failureReason + ")");
    }
}
