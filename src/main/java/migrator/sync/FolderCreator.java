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

import java.util.Objects;
import java.util.Optional;

/**
 * Creates destination folders, idempotently: a folder that already exists under the same parent with the same name is
 * reused instead of being created again, so interrupted runs can simply be restarted.
 */
public class FolderCreator {
    private final RemoteService remote;
    private final RateGovernor governor;
    private final ResponseCache cache;
    private final ProgressCounters counters;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public FolderCreator(RemoteService remote, RateGovernor governor, ResponseCache cache, ProgressCounters counters) {
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
     * Get the ID of the folder named {@code name} under {@code parentId}, creating it if necessary.
     *
     * @param name      Folder name.
     * @param parentId  ID of the parent folder.
     * @return          ID of the existing or new folder, or empty if it couldn't be created. Failures are logged.
     */
    public Optional<String> create(String name, String parentId) {
        try {
            Optional<String> existingId = findExisting(name, parentId);
            if (existingId.isPresent()) {
                logger.info("Folder '{}' already exists in {} ({})", name, parentId, existingId.get());
                counters.update(ProgressEvent.FOLDER_SKIPPED);
                return existingId;
            }

            String newId = governor.executeWithRetry(() -> remote.createFolder(name, parentId));
            if (!verifyExists(newId)) {
                logger.error("Created folder '{}' ({}) but it can't be found", name, newId);
                return Optional.empty();
            }
            cache.remove(CacheKeys.folderByName(parentId, name));
            logger.info("Created folder '{}' in {} ({})", name, parentId, newId);
            counters.update(ProgressEvent.FOLDER_CREATED);
            return Optional.of(newId);
        } catch (RemoteServiceException e) {
            logger.error("Error creating folder '{}' in {}", name, parentId, e);
            return Optional.empty();
        }
    }

    private Optional<String> findExisting(String name, String parentId) throws RemoteServiceException {
        String key = CacheKeys.folderByName(parentId, name);
        Optional<String> cachedId = cache.get(key, String.class);
        if (cachedId.isPresent()) {
            return cachedId;
        }
        Optional<String> id = governor.executeWithRetry(() -> remote.findByName(parentId, name, NodeKind.FOLDER))
                .map(RemoteNode::getId);
        id.ifPresent(folderId -> cache.set(key, folderId));
        return id;
    }

    private boolean verifyExists(String folderId) throws RemoteServiceException {
        return governor.executeWithRetry(() -> remote.getMetadata(folderId))
                .map(RemoteNode::isFolder)
                .orElse(false);
    }
}
