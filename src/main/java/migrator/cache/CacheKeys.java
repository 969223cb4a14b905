package migrator.cache;

/**
 * Builds the {@link ResponseCache} keys of every cached query, so that whoever invalidates an entry uses the same key
 * as whoever cached it.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Complete enumeration of the tree rooted at a folder.
     */
    public static String snapshot(String rootId) {
        return "folder_contents_full_" + rootId;
    }

    /**
     * Number of items found by the last enumeration of the tree rooted at a folder.
     */
    public static String itemCount(String rootId) {
        return "item_count_" + rootId;
    }

    public static String folderDetails(String folderId) {
        return "folder_details_" + folderId;
    }

    public static String fileDetails(String fileId) {
        return "file_details_" + fileId;
    }

    public static String folderByName(String parentId, String name) {
        return "folder_by_name_" + parentId + "_" + name;
    }

    public static String fileInFolder(String parentId, String name) {
        return "file_in_folder_" + parentId + "_" + name;
    }
}
