package migrator.sync;

import migrator.cache.CacheKeys;
import migrator.cache.ResponseCache;
import migrator.governor.RateGovernor;
import migrator.progress.ProgressCounters;
import migrator.progress.ProgressEvent;
import migrator.remote.NodeKind;
import migrator.remote.RemoteNode;
import migrator.remote.RemoteService;
import migrator.remote.RemoteServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Copies single files server-side. A file is not copied if an identical file with the same name is already in the
 * destination folder, which makes re-running an interrupted copy safe.
 */
public class FileCopier {
    private static final Set<String> QUOTA_REASONS = new HashSet<>(Arrays.asList("dailyLimitExceeded", "userRateLimitExceeded"));

    private final RemoteService remote;
    private final RateGovernor governor;
    private final ResponseCache cache;
    private final ProgressCounters counters;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public FileCopier(RemoteService remote, RateGovernor governor, ResponseCache cache, ProgressCounters counters) {
        Objects.requireNonNull(remote);
        Objects.requireNonNull(governor);
        Objects.requireNonNull(cache);
        Objects.requireNonNull(counters);
        this.remote = remote;
        this.governor = governor;
        this.cache = cache;
        this.counters = counters;
    }

    /**
     * Copy a file into a destination folder. Failures are logged and counted, never thrown.
     *
     * @param sourceId      ID of the file to copy.
     * @param destParentId  ID of the destination folder.
     * @param name          Name of the copy.
     * @return              What happened.
     */
    public CopyOutcome copy(String sourceId, String destParentId, String name) {
        try {
            Optional<RemoteNode> source = fileDetails(sourceId);
            if (!source.isPresent()) {
                logger.warn("Skipping copy of '{}': source file {} not found", name, sourceId);
                counters.update(ProgressEvent.FILE_FAILED);
                return CopyOutcome.FAILED;
            }

            Optional<RemoteNode> existing = findInFolder(destParentId, name);
            if (existing.isPresent() && matches(source.get(), existing.get())) {
                logger.info("Skipping identical file '{}'", name);
                counters.update(ProgressEvent.FILE_SKIPPED);
                return CopyOutcome.SKIPPED;
            }

            String copyId = governor.executeWithRetry(() -> remote.copyFile(sourceId, destParentId, name));
            cache.remove(CacheKeys.fileInFolder(destParentId, name));
            logger.info("Copied file '{}' to {} ({})", name, destParentId, copyId);
            counters.update(ProgressEvent.FILE_COPIED);
            return CopyOutcome.COPIED;
        } catch (RemoteServiceException e) {
            if (QUOTA_REASONS.contains(e.getReason())) {
                logger.error("Daily limit or user rate limit exceeded when copying '{}': {}", name, e.getMessage());
            } else {
                logger.error("Error copying '{}' to {}", name, destParentId, e);
            }
            counters.update(ProgressEvent.FILE_FAILED);
            return CopyOutcome.FAILED;
        }
    }

    /**
     * Whether two files have the same content: same size and same content hash. Native documents have no hash, so two
     * native documents match when they are of the same type and size.
     */
    static boolean matches(RemoteNode source, RemoteNode dest) {
        if (source.getContentHash() != null
                && source.getContentHash().equals(dest.getContentHash())
                && source.getSize() == dest.getSize()) {
            return true;
        }
        if (source.isNativeDocument() && dest.isNativeDocument()) {
            return Objects.equals(source.getMimeType(), dest.getMimeType()) && source.getSize() == dest.getSize();
        }
        return false;
    }

    private Optional<RemoteNode> fileDetails(String fileId) throws RemoteServiceException {
        String key = CacheKeys.fileDetails(fileId);
        Optional<RemoteNode> cached = cache.get(key, RemoteNode.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<RemoteNode> details = governor.executeWithRetry(() -> remote.getMetadata(fileId));
        details.ifPresent(file -> cache.set(key, file));
        return details;
    }

    private Optional<RemoteNode> findInFolder(String folderId, String name) throws RemoteServiceException {
        String key = CacheKeys.fileInFolder(folderId, name);
        Optional<RemoteNode> cached = cache.get(key, RemoteNode.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<RemoteNode> found = governor.executeWithRetry(() -> remote.findByName(folderId, name, NodeKind.FILE));
        found.ifPresent(file -> cache.set(key, file));
        return found;
    }
}
