package migrator;

/**
 * Various utility methods, not necessarily related, mostly about MIME types and relative paths.
 * <p>
 * Relative paths are the keys of {@link migrator.discovery.TreeSnapshot}s: folder names joined with
 * {@link #PATH_SEPARATOR}, relative to the enumerated root, which is itself the empty path.
 */
public class Util {
    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
    public static final String NATIVE_DOCUMENT_MIME_PREFIX = "application/vnd.google-apps.";
    public static final String PATH_SEPARATOR = "/";

    private Util() {
    }

    /**
     * @param mimeType  The MIME type of a remote file.
     * @return          Whether the MIME type is that of a folder.
     */
    public static boolean isFolder(String mimeType) {
        return FOLDER_MIME_TYPE.equals(mimeType);
    }

    /**
     * Checks whether the specified MIME type is that of a native document (Docs, Sheets, Slides, Forms, etc.). These
     * files have no byte content on Drive, thus no size and no checksum.
     *
     * @param mimeType  The MIME type of a remote file.
     * @return          Whether it is a native document.
     */
    public static boolean isNativeDocument(String mimeType) {
        return mimeType != null && mimeType.startsWith(NATIVE_DOCUMENT_MIME_PREFIX) && !isFolder(mimeType);
    }

    /**
     * Escape a value to be used between single quotes in a Drive search query.
     *
     * @see <a href="https://developers.google.com/drive/api/guides/search-files">Search query terms</a>
     */
    public static String escapeQueryValue(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    /**
     * Append a name to a relative path.
     *
     * @param parentPath    Parent path, empty for the root.
     * @param name          Name of the child.
     * @return              The child's relative path.
     */
    public static String joinPath(String parentPath, String name) {
        return parentPath.isEmpty() ? name : parentPath + PATH_SEPARATOR + name;
    }

    /**
     * @return The path of the parent of {@code path}, empty if {@code path} is a child of the root.
     */
    public static String parentPath(String path) {
        int index = path.lastIndexOf(PATH_SEPARATOR);
        return index < 0 ? "" : path.substring(0, index);
    }

    /**
     * @return The last segment of {@code path}, ie. the name of the file or folder.
     */
    public static String lastSegment(String path) {
        return path.substring(path.lastIndexOf(PATH_SEPARATOR) + 1);
    }

    /**
     * Depth of a path, counted as the number of separators it has. Children of the root have depth 0.
     */
    public static int depth(String path) {
        int depth = 0;
        for (int i = path.indexOf(PATH_SEPARATOR); i >= 0; i = path.indexOf(PATH_SEPARATOR, i + 1)) {
            depth++;
        }
        return depth;
    }

    /**
     * @return The lowercase extension of the last segment of {@code path}, or {@code null} if it has none.
     */
    public static String extension(String path) {
        String name = lastSegment(path);
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? null : name.substring(dot + 1).toLowerCase();
    }
}
