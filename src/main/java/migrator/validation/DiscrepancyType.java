package migrator.validation;

public enum DiscrepancyType {
    MISSING_FILE,
    SIZE_MISMATCH,
    HASH_MISMATCH,
    MISSING_FOLDER,
    /** A destination folder with no source counterpart. Only reported when comparing, sync never removes anything. */
    EXTRA_FOLDER
}
