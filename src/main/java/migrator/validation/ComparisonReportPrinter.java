package migrator.validation;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints a {@link ComparisonReport} for humans.
 */
public class ComparisonReportPrinter {
    private static final int TOP_EXTENSIONS = 5;
    private static final int LISTED_ENTRIES = 10;
    private static final double MB = 1024 * 1024;
    private static final double GB = MB * 1024;

    private final PrintStream out;

    public ComparisonReportPrinter(PrintStream out) {
        Objects.requireNonNull(out);
        this.out = out;
    }

    public void print(ComparisonReport report) {
        out.println();
        out.println("Folder Comparison Report");
        out.println("========================");
        out.println();
        out.println("Overall Statistics:");
        printSide("Source", report.getSource());
        printSide("Destination", report.getDestination());

        out.println();
        out.println("Performance Metrics:");
        printf("Elapsed Time: %.2f seconds%n", report.getElapsed().toMillis() / 1000.0);
        printf("Processing Speed: %.2f files/second%n", report.getFilesPerSecond());

        out.println();
        printf("Completion: %.1f%%%n", report.getCompletionPercentage());

        out.println();
        out.println("Directory Structure:");
        printf("Maximum Depth: %d levels%n", report.getDepthStats().getMaxDepth());
        printf("Average Depth: %.1f levels%n", report.getDepthStats().getAverageDepth());

        out.println();
        out.println("Top File Types:");
        for (ExtensionStats stats : report.getTopExtensions(TOP_EXTENSIONS)) {
            printf("  .%s: %d files, %.2f MB%n", stats.getExtension(), stats.getCount(), stats.getTotalSize() / MB);
        }

        if (report.isIdentical()) {
            out.println();
            out.println("No discrepancies found - folders are identical!");
        } else {
            out.println();
            out.println("Discrepancies Found:");
            printMissingFiles(report.getDiscrepancies(DiscrepancyType.MISSING_FILE));
            printSizeMismatches(report.getDiscrepancies(DiscrepancyType.SIZE_MISMATCH));
            printPaths("Checksum Mismatches", report.getDiscrepancies(DiscrepancyType.HASH_MISMATCH), "mismatches");
            printPaths("Missing Folders", report.getDiscrepancies(DiscrepancyType.MISSING_FOLDER), "folders");
            printPaths("Extra Folders", report.getDiscrepancies(DiscrepancyType.EXTRA_FOLDER), "folders");
        }

        report.getDetails().ifPresent(details -> {
            out.println();
            out.println("Details:");
            printf("  Matching files: %d%n", details.getMatchingFiles().size());
            printf("  Different files: %d%n", details.getDifferentFiles().size());
            printf("  Missing files: %d%n", details.getMissingFiles().size());
            printf("  Matching folders: %d%n", details.getMatchingFolders().size());
        });
    }

    private void printSide(String label, ComparisonReport.SideStats stats) {
        printf("%s: %d files, %d folders, %.2f GB%n", label, stats.getFiles(), stats.getFolders(), stats.getTotalSize() / GB);
    }

    private void printMissingFiles(List<Discrepancy> missing) {
        if (missing.isEmpty()) {
            return;
        }
        out.println();
        printf("Missing Files (%d):%n", missing.size());
        printf("Total size of missing files: %.2f MB%n", totalSourceSize(missing) / MB);
        for (Discrepancy file : missing.subList(0, Math.min(LISTED_ENTRIES, missing.size()))) {
            printf("  %s (%.2f MB)%n", file.getPath(), file.getSourceSize() / MB);
        }
        if (missing.size() > LISTED_ENTRIES) {
            List<Discrepancy> remaining = missing.subList(LISTED_ENTRIES, missing.size());
            printf("  ...and %d more files (total remaining size: %.2f MB)%n", remaining.size(), totalSourceSize(remaining) / MB);
        }
    }

    private void printSizeMismatches(List<Discrepancy> mismatches) {
        if (mismatches.isEmpty()) {
            return;
        }
        out.println();
        printf("Size Mismatches (%d):%n", mismatches.size());
        for (Discrepancy mismatch : mismatches.subList(0, Math.min(LISTED_ENTRIES, mismatches.size()))) {
            printf("  %s%n", mismatch.getPath());
            printf("    Source: %.2f MB%n", mismatch.getSourceSize() / MB);
            printf("    Destination: %.2f MB%n", mismatch.getDestSize() / MB);
        }
        printRemaining(mismatches.size(), "mismatches");
    }

    private void printPaths(String title, List<Discrepancy> entries, String noun) {
        if (entries.isEmpty()) {
            return;
        }
        out.println();
        printf("%s (%d):%n", title, entries.size());
        entries.stream()
                .map(Discrepancy::getPath)
                .sorted()
                .limit(LISTED_ENTRIES)
                .forEach(path -> printf("  %s%n", path));
        printRemaining(entries.size(), noun);
    }

    private void printRemaining(int total, String noun) {
        if (total > LISTED_ENTRIES) {
            printf("  ...and %d more %s%n", total - LISTED_ENTRIES, noun);
        }
    }

    private static long totalSourceSize(List<Discrepancy> files) {
        long total = 0;
        for (Discrepancy file : files) {
            total += file.getSourceSize();
        }
        return total;
    }

    private void printf(String format, Object... args) {
        out.printf(Locale.ROOT, format, args);
    }
}
