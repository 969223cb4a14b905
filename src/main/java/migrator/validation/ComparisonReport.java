package migrator.validation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of a {@link TreeComparator} audit.
 */
public class ComparisonReport {
    private final SideStats source;
    private final SideStats destination;
    private final Map<String, ExtensionStats> extensions;
    private final DepthStats depthStats;
    private final List<Discrepancy> discrepancies;
    private final Duration elapsed;
    private final Details details;

    ComparisonReport(SideStats source, SideStats destination, Map<String, ExtensionStats> extensions,
                     DepthStats depthStats, List<Discrepancy> discrepancies, Duration elapsed, Details details) {
        this.source = source;
        this.destination = destination;
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
        this.depthStats = depthStats;
        this.discrepancies = Collections.unmodifiableList(new ArrayList<>(discrepancies));
        this.elapsed = elapsed;
        this.details = details;
    }

    public SideStats getSource() {
        return source;
    }

    public SideStats getDestination() {
        return destination;
    }

    /**
     * @return Statistics of the source files by lowercase extension, {@link ExtensionStats#NO_EXTENSION} for files
     *         without one.
     */
    public Map<String, ExtensionStats> getExtensions() {
        return extensions;
    }

    /**
     * @param limit Maximum number of extensions to return.
     * @return      The most frequent extensions, most frequent first.
     */
    public List<ExtensionStats> getTopExtensions(int limit) {
        return extensions.values().stream()
                .sorted(Comparator.comparingInt(ExtensionStats::getCount).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * @return Depth statistics of the source folders.
     */
    public DepthStats getDepthStats() {
        return depthStats;
    }

    public List<Discrepancy> getDiscrepancies() {
        return discrepancies;
    }

    public List<Discrepancy> getDiscrepancies(DiscrepancyType type) {
        return discrepancies.stream().filter(d -> d.getType() == type).collect(Collectors.toList());
    }

    public boolean isIdentical() {
        return discrepancies.isEmpty();
    }

    /**
     * Destination file count over source file count, 100 when the source has no file. Not capped, extra destination
     * files count too.
     */
    public double getCompletionPercentage() {
        return source.getFiles() == 0 ? 100.0 : destination.getFiles() * 100.0 / source.getFiles();
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * @return Source and destination files enumerated per second.
     */
    public double getFilesPerSecond() {
        double seconds = elapsed.toMillis() / 1000.0;
        return seconds > 0 ? (source.getFiles() + destination.getFiles()) / seconds : 0;
    }

    /**
     * @return Per-path lists, only available in detailed mode.
     */
    public Optional<Details> getDetails() {
        return Optional.ofNullable(details);
    }

    /**
     * Totals of one side of the comparison.
     */
    public static class SideStats {
        private final int files;
        private final int folders;
        private final long totalSize;

        public SideStats(int files, int folders, long totalSize) {
            this.files = files;
            this.folders = folders;
            this.totalSize = totalSize;
        }

        public int getFiles() {
            return files;
        }

        public int getFolders() {
            return folders;
        }

        public long getTotalSize() {
            return totalSize;
        }
    }

    /**
     * Paths of the matching, different and missing files and of the matching folders. Files are compared by size only.
     */
    public static class Details {
        private final List<String> matchingFiles;
        private final List<Discrepancy> differentFiles;
        private final List<String> missingFiles;
        private final List<String> matchingFolders;

        Details(List<String> matchingFiles, List<Discrepancy> differentFiles, List<String> missingFiles, List<String> matchingFolders) {
            this.matchingFiles = Collections.unmodifiableList(matchingFiles);
            this.differentFiles = Collections.unmodifiableList(differentFiles);
            this.missingFiles = Collections.unmodifiableList(missingFiles);
            this.matchingFolders = Collections.unmodifiableList(matchingFolders);
        }

        public List<String> getMatchingFiles() {
            return matchingFiles;
        }

        public List<Discrepancy> getDifferentFiles() {
            return differentFiles;
        }

        public List<String> getMissingFiles() {
            return missingFiles;
        }

        public List<String> getMatchingFolders() {
            return matchingFolders;
        }
    }
}
