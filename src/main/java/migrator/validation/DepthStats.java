package migrator.validation;

import migrator.Util;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Depth statistics of a set of folder paths. Depth is as defined by {@link Util#depth(String)}.
 */
public class DepthStats {
    private final int maxDepth;
    private final double averageDepth;
    private final Map<Integer, Integer> distribution;

    private DepthStats(int maxDepth, double averageDepth, Map<Integer, Integer> distribution) {
        this.maxDepth = maxDepth;
        this.averageDepth = averageDepth;
        this.distribution = Collections.unmodifiableMap(distribution);
    }

    public static DepthStats of(Collection<String> folderPaths) {
        Map<Integer, Integer> distribution = new TreeMap<>();
        int max = 0;
        long sum = 0;
        for (String path : folderPaths) {
            int depth = Util.depth(path);
            distribution.merge(depth, 1, Integer::sum);
            max = Math.max(max, depth);
            sum += depth;
        }
        double average = folderPaths.isEmpty() ? 0 : (double) sum / folderPaths.size();
        return new DepthStats(max, average, distribution);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public double getAverageDepth() {
        return averageDepth;
    }

    /**
     * @return Number of folders at each depth, by ascending depth.
     */
    public Map<Integer, Integer> getDistribution() {
        return distribution;
    }
}
