package migrator.validation;

import migrator.Util;
import migrator.discovery.EnumerationException;
import migrator.discovery.FileEntry;
import migrator.discovery.TreeEnumerator;
import migrator.discovery.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Audits a destination tree against its source without modifying anything: totals, file types, folder depths and
 * every discrepancy, including destination folders the source doesn't have.
 */
public class TreeComparator {
    private final TreeEnumerator enumerator;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public TreeComparator(TreeEnumerator enumerator, Clock clock) {
        Objects.requireNonNull(enumerator, "Enumerator may not be null");
        Objects.requireNonNull(clock, "Clock may not be null");
        this.enumerator = enumerator;
        this.clock = clock;
    }

    public TreeComparator(TreeEnumerator enumerator) {
        this(enumerator, Clock.systemUTC());
    }

    /**
     * Enumerate and compare two trees.
     *
     * @param detailed  Whether to include per-path lists in the report.
     * @throws EnumerationException If either root can't be listed.
     */
    public ComparisonReport compare(String sourceRootId, String destRootId, boolean detailed) throws EnumerationException {
        Instant start = clock.instant();
        logger.info("Analyzing source folder...");
        TreeSnapshot source = enumerator.enumerate(sourceRootId);
        logger.info("Analyzing destination folder...");
        TreeSnapshot dest = enumerator.enumerate(destRootId);
        return compare(source, dest, detailed, Duration.between(start, clock.instant()));
    }

    ComparisonReport compare(TreeSnapshot source, TreeSnapshot dest, boolean detailed, Duration elapsed) {
        Map<String, ExtensionStats> extensions = new TreeMap<>();
        List<Discrepancy> discrepancies = new ArrayList<>();
        List<String> matchingFiles = new ArrayList<>();
        List<Discrepancy> differentFiles = new ArrayList<>();
        List<String> missingFiles = new ArrayList<>();

        for (Map.Entry<String, FileEntry> entry : source.getFiles().entrySet()) {
            String path = entry.getKey();
            FileEntry sourceFile = entry.getValue();
            String extension = Util.extension(path);
            extensions.computeIfAbsent(extension == null ? ExtensionStats.NO_EXTENSION : extension, ExtensionStats::new)
                    .add(sourceFile.getSize());

            FileEntry destFile = dest.getFiles().get(path);
            if (destFile == null) {
                discrepancies.add(Discrepancy.missingFile(path, sourceFile.getSize()));
                missingFiles.add(path);
            } else if (sourceFile.getSize() != destFile.getSize()) {
                Discrepancy mismatch = Discrepancy.sizeMismatch(path, sourceFile.getSize(), destFile.getSize());
                discrepancies.add(mismatch);
                differentFiles.add(mismatch);
            } else {
                if (sourceFile.hashDiffers(destFile)) {
                    discrepancies.add(Discrepancy.hashMismatch(path, sourceFile.getSize()));
                }
                matchingFiles.add(path);
            }
        }

        List<String> matchingFolders = new ArrayList<>();
        for (String folder : source.getFolders().keySet()) {
            if (dest.getFolders().containsKey(folder)) {
                matchingFolders.add(folder);
            } else {
                discrepancies.add(Discrepancy.missingFolder(folder));
            }
        }
        for (String folder : dest.getFolders().keySet()) {
            if (!source.getFolders().containsKey(folder)) {
                discrepancies.add(Discrepancy.extraFolder(folder));
            }
        }

        ComparisonReport.Details details = detailed
                ? new ComparisonReport.Details(matchingFiles, differentFiles, missingFiles, matchingFolders)
                : null;
        ComparisonReport report = new ComparisonReport(
                new ComparisonReport.SideStats(source.getFiles().size(), source.getFolders().size(), source.getTotalSize()),
                new ComparisonReport.SideStats(dest.getFiles().size(), dest.getFolders().size(), dest.getTotalSize()),
                extensions,
                DepthStats.of(source.getFolders().keySet()),
                discrepancies,
                elapsed,
                details);
        logger.info("Comparison done in {} ms: {} discrepancies, {}% complete",
                elapsed.toMillis(), discrepancies.size(), String.format("%.1f", report.getCompletionPercentage()));
        return report;
    }
}
