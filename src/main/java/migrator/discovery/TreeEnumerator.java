package migrator.discovery;

import migrator.Util;
import migrator.cache.CacheKeys;
import migrator.cache.ResponseCache;
import migrator.discovery.traversal.DfsTraversalStrategy;
import migrator.discovery.traversal.PendingFolder;
import migrator.discovery.traversal.TraversalStrategy;
import migrator.governor.RateGovernor;
import migrator.remote.ChildPage;
import migrator.remote.RemoteNode;
import migrator.remote.RemoteService;
import migrator.remote.RemoteServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Walks down a remote folder all the way to the leaves, producing a flat {@link TreeSnapshot}. Listings are paginated
 * transparently and every request goes through the {@link RateGovernor}.
 * <p>
 * Complete snapshots are cached as a unit: enumerating the same root again within the cache's time to live costs no
 * request at all. Whoever modifies a tree must {@link #invalidate(String)} it.
 * <p>
 * A listing failure below the root doesn't abort enumeration. The failed folder is recorded in
 * {@link TreeSnapshot#getIncompletePaths()} and its subtree is left under-populated. Retrying transient failures is
 * the governor's job, anything that still fails after that is considered permanent.
 */
public class TreeEnumerator {
    private final RemoteService remote;
    private final RateGovernor governor;
    private final ResponseCache cache;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public TreeEnumerator(RemoteService remote, RateGovernor governor, ResponseCache cache) {
        Objects.requireNonNull(remote, "Remote service may not be null");
        Objects.requireNonNull(governor, "Rate governor may not be null");
        Objects.requireNonNull(cache, "Cache may not be null");
        this.remote = remote;
        this.governor = governor;
        this.cache = cache;
    }

    /**
     * Enumerate the tree rooted at the specified folder.
     *
     * @param rootId    ID of the root folder.
     * @return          The snapshot of the tree. Check {@link TreeSnapshot#isComplete()}.
     * @throws EnumerationException If the root folder itself can't be listed.
     */
    public TreeSnapshot enumerate(String rootId) throws EnumerationException {
        Optional<TreeSnapshot> cached = cache.get(CacheKeys.snapshot(rootId), TreeSnapshot.class);
        if (cached.isPresent()) {
            logger.debug("Using cached enumeration of {}: {}", rootId, cached.get());
            return cached.get();
        }

        // Total from the previous enumeration, if any, only used to report progress
        int total = cache.get(CacheKeys.itemCount(rootId), Integer.class).orElse(0);
        Progress progress = new Progress(rootId, total);

        Map<String, FileEntry> files = new LinkedHashMap<>();
        Map<String, String> folders = new LinkedHashMap<>();
        Set<String> incompletePaths = new LinkedHashSet<>();

        TraversalStrategy traversal = new DfsTraversalStrategy(new PendingFolder("", rootId));
        while (!traversal.isDone()) {
            PendingFolder current = traversal.next();
            List<PendingFolder> subfolders = new ArrayList<>();
            String pageToken = null;
            do {
                ChildPage page;
                try {
                    page = listPage(current.getFolderId(), pageToken);
                } catch (RemoteServiceException e) {
                    if (current.isRoot() && pageToken == null) {
                        throw new EnumerationException("Couldn't list root folder " + rootId, e);
                    }
                    logger.error("Error listing folder {}, its contents will be incomplete", current, e);
                    incompletePaths.add(current.getPath());
                    break;
                }
                for (RemoteNode child : page.getItems()) {
                    String childPath = Util.joinPath(current.getPath(), child.getName());
                    if (child.isFolder()) {
                        if (folders.put(childPath, child.getId()) != null) {
                            logger.warn("Found several folders at {}, their contents will be merged", childPath);
                        }
                        subfolders.add(new PendingFolder(childPath, child.getId()));
                    } else {
                        if (files.put(childPath, FileEntry.of(child)) != null) {
                            logger.debug("Found several files at {}, keeping the newest", childPath);
                        }
                    }
                }
                progress.processed(page.getItems().size());
                logger.debug("Listed {} items in {} ({} so far)", page.getItems().size(), current, progress.count);
                pageToken = page.getNextPageToken();
            } while (pageToken != null);

            // Reverse, so subfolders are listed in the order they were found
            for (int i = subfolders.size() - 1; i >= 0; i--) {
                traversal.add(subfolders.get(i));
            }
        }

        TreeSnapshot snapshot = new TreeSnapshot(rootId, files, folders, incompletePaths);
        logger.info("Enumerated {}: {} files, {} folders", rootId, files.size(), folders.size());
        cache.set(CacheKeys.itemCount(rootId), progress.count);
        if (snapshot.isComplete()) {
            cache.set(CacheKeys.snapshot(rootId), snapshot);
        } else {
            logger.warn("Enumeration of {} is incomplete, {} folder(s) couldn't be listed: {}",
                    rootId, incompletePaths.size(), incompletePaths);
        }
        return snapshot;
    }

    /**
     * Forget the cached enumeration of a tree, so the next {@link #enumerate(String)} fetches it again.
     */
    public void invalidate(String rootId) {
        cache.remove(CacheKeys.snapshot(rootId));
    }

    private ChildPage listPage(String folderId, String pageToken) throws RemoteServiceException {
        return governor.executeWithRetry(() -> remote.listChildren(folderId, pageToken));
    }

    /**
     * Processed item count against the total of the previous enumeration. Purely informative.
     */
    private class Progress {
        private final String rootId;
        private final int total;
        private int count = 0;
        private int lastReportedDecile = 0;

        Progress(String rootId, int total) {
            this.rootId = rootId;
            this.total = total;
        }

        void processed(int items) {
            count += items;
            int decile = (int) (percentage() / 10);
            if (decile > lastReportedDecile) {
                lastReportedDecile = decile;
                logger.info("Enumerating {}: {}% complete", rootId, String.format("%.1f", percentage()));
            }
        }

        double percentage() {
            return total > 0 ? Math.min(100.0, count * 100.0 / total) : 0;
        }
    }
}
