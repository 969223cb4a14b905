package migrator.diff;

import migrator.Util;
import migrator.discovery.FileEntry;
import migrator.discovery.TreeSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Computes what must be created and copied for a destination tree to match a source tree. Nothing is ever planned for
 * removal.
 */
public class Differ {

    /**
     * Plan the copy of every source file that is missing from the destination or differs from its destination
     * counterpart. Files differ when their sizes differ, or when both have a content hash and the hashes differ. Size
     * alone is enough, hashes are only compared when both are known.
     *
     * @param source    Source snapshot.
     * @param dest      Destination snapshot.
     * @return          The copies to perform, in source enumeration order.
     */
    public DiffPlan diff(TreeSnapshot source, TreeSnapshot dest) {
        List<PlannedCopy> copies = new ArrayList<>();
        for (Map.Entry<String, FileEntry> entry : source.getFiles().entrySet()) {
            String path = entry.getKey();
            FileEntry sourceFile = entry.getValue();
            FileEntry destFile = dest.getFiles().get(path);
            if (destFile == null
                    || sourceFile.getSize() != destFile.getSize()
                    || sourceFile.hashDiffers(destFile)) {
                copies.add(new PlannedCopy(sourceFile.getId(), path));
            }
        }
        return new DiffPlan(copies);
    }

    /**
     * Folder paths present in the source but not in the destination, shallowest first so that parents always come
     * before their children, then by path.
     *
     * @param source    Source snapshot.
     * @param dest      Destination snapshot.
     * @return          The missing folder paths.
     */
    public List<String> missingFolders(TreeSnapshot source, TreeSnapshot dest) {
        return source.getFolders().keySet().stream()
                .filter(path -> !dest.getFolders().containsKey(path))
                .sorted(Comparator.comparingInt(Util::depth).thenComparing(Comparator.<String>naturalOrder()))
                .collect(Collectors.toList());
    }
}
