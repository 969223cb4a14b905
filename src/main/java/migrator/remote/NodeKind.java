package migrator.remote;

/**
 * Kind of a remote node. Drive doesn't have real directories, folders are files with a special MIME type.
 */
public enum NodeKind {
    FILE,
    FOLDER
}
