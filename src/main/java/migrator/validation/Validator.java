package migrator.validation;

import migrator.discovery.EnumerationException;
import migrator.discovery.FileEntry;
import migrator.discovery.TreeEnumerator;
import migrator.discovery.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks that every source file and folder is present in the destination with the same content. Read-only.
 */
public class Validator {
    private static final int LOGGED_DISCREPANCIES = 10;

    private final TreeEnumerator enumerator;
    private final Logger logger = LoggerFactory.getLogger(getClass());

    public Validator(TreeEnumerator enumerator) {
        Objects.requireNonNull(enumerator, "Enumerator may not be null");
        this.enumerator = enumerator;
    }

    /**
     * Enumerate both trees and validate them. Cached enumerations are used if available, so whoever modified the
     * destination must have invalidated it first.
     *
     * @throws EnumerationException If either root can't be listed.
     */
    public ValidationReport validate(String sourceRootId, String destRootId) throws EnumerationException {
        logger.info("Starting validation...");
        TreeSnapshot source = enumerator.enumerate(sourceRootId);
        TreeSnapshot dest = enumerator.enumerate(destRootId);
        return validate(source, dest);
    }

    public ValidationReport validate(TreeSnapshot source, TreeSnapshot dest) {
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (Map.Entry<String, FileEntry> entry : source.getFiles().entrySet()) {
            String path = entry.getKey();
            FileEntry sourceFile = entry.getValue();
            FileEntry destFile = dest.getFiles().get(path);
            if (destFile == null) {
                discrepancies.add(Discrepancy.missingFile(path, sourceFile.getSize()));
            } else if (sourceFile.getSize() != destFile.getSize()) {
                discrepancies.add(Discrepancy.sizeMismatch(path, sourceFile.getSize(), destFile.getSize()));
            } else if (sourceFile.hashDiffers(destFile)) {
                discrepancies.add(Discrepancy.hashMismatch(path, sourceFile.getSize()));
            }
        }
        for (String folder : source.getFolders().keySet()) {
            if (!dest.getFolders().containsKey(folder)) {
                discrepancies.add(Discrepancy.missingFolder(folder));
            }
        }

        ValidationReport report = new ValidationReport(discrepancies, source.getFiles().size(), source.getFolders().size());
        if (report.isPassed()) {
            logger.info("Validation passed. All files and folders match.");
        } else {
            logger.error("Validation failed: {}", report);
            for (int i = 0; i < Math.min(LOGGED_DISCREPANCIES, discrepancies.size()); i++) {
                logger.error(" - {}", discrepancies.get(i).getMessage());
            }
            if (discrepancies.size() > LOGGED_DISCREPANCIES) {
                logger.error("...and {} more", discrepancies.size() - LOGGED_DISCREPANCIES);
                discrepancies.subList(LOGGED_DISCREPANCIES, discrepancies.size())
                        .forEach(d -> logger.debug(" - {}", d.getMessage()));
            }
        }
        return report;
    }
}
