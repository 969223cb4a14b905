package migrator.sync;

import migrator.Config;
import migrator.Util;
import migrator.cache.ResponseCache;
import migrator.diff.DiffPlan;
import migrator.diff.Differ;
import migrator.diff.PlannedCopy;
import migrator.discovery.EnumerationException;
import migrator.discovery.TreeEnumerator;
import migrator.discovery.TreeSnapshot;
import migrator.governor.RateGovernor;
import migrator.progress.ProgressCounters;
import migrator.progress.ProgressEvent;
import migrator.progress.ProgressListener;
import migrator.remote.RemoteNode;
import migrator.remote.RemoteService;
import migrator.remote.RemoteServiceException;
import migrator.validation.ValidationReport;
import migrator.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Brings the configured destination folder up to date with the source folder: enumerates both trees, creates the
 * missing folders (parents first), copies the missing or changed files and optionally validates the result.
 * Destination items absent from the source are left alone.
 * <p>
 * Every step runs sequentially. Failing to copy or create one item is logged and counted but doesn't stop the run;
 * failing the preflight checks or the enumeration of a root does.
 */
public class SyncEngine {
    private final RemoteService remote;
    private final RateGovernor governor;
    private final ResponseCache cache;
    private final Config config;
    private final ProgressListener listener;
    private final TreeEnumerator enumerator;
    private final Differ differ = new Differ();
    private final Validator validator;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public SyncEngine(RemoteService remote, RateGovernor governor, ResponseCache cache, Config config, ProgressListener listener) {
        Objects.requireNonNull(remote, "Remote service may not be null");
        Objects.requireNonNull(governor, "Rate governor may not be null");
        Objects.requireNonNull(cache, "Cache may not be null");
        Objects.requireNonNull(config, "Config may not be null");
        Objects.requireNonNull(listener, "Listener may not be null");
        this.remote = remote;
        this.governor = governor;
        this.cache = cache;
        this.config = config;
        this.listener = listener;
        this.enumerator = new TreeEnumerator(remote, governor, cache);
        this.validator = new Validator(enumerator);
    }

    /**
     * Run a complete sync pass.
     *
     * @return The result. Never throws, failures are reported in the result.
     */
    public SyncResult run() {
        ProgressCounters counters = new ProgressCounters(listener);
        SyncResult result = new SyncResult(counters);
        String sourceId = config.getSourceFolderId();
        String destId = config.getDestinationFolderId();

        enter(SyncState.PREFLIGHT, result);
        if (!checkAccess("Source", sourceId) || !checkAccess("Destination", destId)) {
            return fail(result, "Preflight checks failed");
        }

        try {
            enter(SyncState.ENUMERATE_SOURCE, result);
            logger.info("Collecting entire source structure...");
            TreeSnapshot source = enumerator.enumerate(sourceId);
            logger.info("Found {} files, {} folders in source", source.getFiles().size(), source.getFolders().size());

            enter(SyncState.ENUMERATE_DEST, result);
            logger.info("Collecting entire destination structure...");
            TreeSnapshot dest = enumerator.enumerate(destId);
            logger.info("Found {} files, {} folders in destination", dest.getFiles().size(), dest.getFolders().size());

            counters.setTotals(source.getFiles().size(), source.getFolders().size());
            reconcile(source, dest, result);
            if (!result.getFailedPaths().isEmpty()) {
                return fail(result, result.getFailedPaths().size() + " file(s) failed to copy");
            }

            if (config.isFinalValidation()) {
                enter(SyncState.VALIDATE, result);
                ValidationReport report = validator.validate(sourceId, destId);
                if (!report.isPassed() && config.isAutoFixMissing() && report.hasMissingItems()) {
                    logger.warn("Validation found {} discrepancies, copying missing files again", report.getDiscrepancies().size());
                    reconcile(enumerator.enumerate(sourceId), enumerator.enumerate(destId), result);
                    if (!result.getFailedPaths().isEmpty()) {
                        return fail(result, result.getFailedPaths().size() + " file(s) failed to copy while repairing");
                    }
                    enter(SyncState.VALIDATE, result);
                    report = validator.validate(sourceId, destId);
                }
                result.setValidation(report);
                if (!report.isPassed()) {
                    return fail(result, "Validation found " + report.getDiscrepancies().size() + " discrepancies");
                }
            }
        } catch (EnumerationException e) {
            logger.error("Couldn't enumerate folder tree", e);
            return fail(result, e.getMessage());
        }

        enter(SyncState.DONE, result);
        logger.info("Sync completed successfully: {}", counters);
        return result;
    }

    /**
     * Diff two snapshots, create the missing folders and copy the planned files. Invalidates the destination's cached
     * enumeration afterwards.
     */
    private void reconcile(TreeSnapshot source, TreeSnapshot dest, SyncResult result) {
        if (!source.isComplete()) {
            logger.warn("Source enumeration is incomplete, files under {} won't be copied", source.getIncompletePaths());
        }
        if (!dest.isComplete()) {
            logger.warn("Destination enumeration is incomplete, files under {} may be copied needlessly", dest.getIncompletePaths());
        }

        enter(SyncState.DIFF, result);
        DiffPlan plan = differ.diff(source, dest);
        List<String> missingFolders = differ.missingFolders(source, dest);
        result.setPlannedCopies(plan.size());
        result.setMissingFolders(missingFolders.size());
        logger.info("Need to copy {} files (missing or different) and create {} folders", plan.size(), missingFolders.size());

        DestinationFolders folders = new DestinationFolders(dest.getRootId(), dest.getFolders());
        FolderCreator folderCreator = new FolderCreator(remote, governor, cache, result.getCounters());
        try {
            enter(SyncState.CREATE_FOLDERS, result);
            createFolders(missingFolders, folders, folderCreator, result);

            enter(SyncState.COPY_FILES, result);
            copyFiles(plan, folders, folderCreator, result);
        } finally {
            if (!missingFolders.isEmpty() || !plan.isEmpty()) {
                enumerator.invalidate(dest.getRootId());
            }
        }
    }

    private void createFolders(List<String> missingFolders, DestinationFolders folders, FolderCreator creator, SyncResult result) {
        for (String path : missingFolders) {
            if (folders.contains(path)) {
                continue;
            }
            String parentPath = Util.parentPath(path);
            Optional<String> parentId = folders.resolve(parentPath);
            if (!parentId.isPresent()) {
                InconsistentTreeException e = new InconsistentTreeException(path,
                        "Missing parent folder '" + parentPath + "' in destination while creating '" + path + "'");
                logger.warn(e.getMessage());
                result.addSkippedFolder(path);
                continue;
            }
            Optional<String> folderId = creator.create(Util.lastSegment(path), parentId.get());
            if (folderId.isPresent()) {
                folders.put(path, folderId.get());
            } else {
                logger.error("Failed to create folder '{}' in destination", path);
            }
        }
    }

    private void copyFiles(DiffPlan plan, DestinationFolders folders, FolderCreator folderCreator, SyncResult result) {
        FileCopier copier = new FileCopier(remote, governor, cache, result.getCounters());
        int total = plan.size();
        int index = 0;
        logger.info("Starting copy of {} files", total);
        for (PlannedCopy copy : plan) {
            index++;
            String path = copy.getRelativePath();
            Optional<String> parentId = folders.resolveOrCreate(Util.parentPath(path), folderCreator);
            CopyOutcome outcome;
            if (!parentId.isPresent()) {
                logger.error("Failed copying '{}': no destination folder", path);
                result.getCounters().update(ProgressEvent.FILE_FAILED);
                outcome = CopyOutcome.FAILED;
            } else {
                logger.debug("[{}/{}] Copying '{}' to {}", index, total, path, parentId.get());
                outcome = copier.copy(copy.getSourceFileId(), parentId.get(), Util.lastSegment(path));
            }
            if (!outcome.isSuccessful()) {
                logger.error("Failed copying '{}'", path);
                result.addFailedPath(path);
            }
        }
    }

    /**
     * Check that a root folder exists and is accessible. Never cached, this is about the current state of the remote.
     */
    private boolean checkAccess(String label, String folderId) {
        logger.info("Running {} folder access check...", label.toLowerCase());
        try {
            Optional<RemoteNode> folder = governor.executeWithRetry(() -> remote.getMetadata(folderId));
            if (!folder.isPresent()) {
                logger.error("{} folder {} not found or not accessible", label, folderId);
                return false;
            }
            if (!folder.get().isFolder()) {
                logger.error("{} {} is not a folder", label, folder.get());
                return false;
            }
            logger.info("{} folder access check passed: {}", label, folder.get());
            return true;
        } catch (RemoteServiceException e) {
            logger.error("{} folder access check failed for {}", label, folderId, e);
            return false;
        }
    }

    private void enter(SyncState state, SyncResult result) {
        if (result.getState().isTerminal()) {
            throw new IllegalStateException("Run already ended in " + result.getState());
        }
        logger.debug("{} -> {}", result.getState(), state);
        result.setState(state);
        result.getCounters().enterState(state);
    }

    private SyncResult fail(SyncResult result, String reason) {
        logger.error("Sync failed in {}: {}", result.getState(), reason);
        result.setFailureReason(reason);
        enter(SyncState.FAILED, result);
        return result;
    }
}
