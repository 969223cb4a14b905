package migrator.remote;

import java.util.Optional;

/**
 * What the migrator needs from the remote file store. Implementations must be safe to retry on every call, and must
 * classify every failure as either a {@link TransientServiceException} or a {@link PermanentServiceException}.
 *
 * @see DriveRemoteService
 */
public interface RemoteService {

    /**
     * Fetch the metadata of a file or folder.
     *
     * @param id    Remote ID.
     * @return      The node, or empty if no node with the specified ID exists.
     * @throws RemoteServiceException On any other failure.
     */
    Optional<RemoteNode> getMetadata(String id) throws RemoteServiceException;

    /**
     * List one page of the (non-trashed) children of a folder. Call again with the returned
     * {@link ChildPage#getNextPageToken() token} until it is {@code null} to get the complete listing.
     *
     * @param parentId  ID of the folder to list.
     * @param pageToken Token of the page to fetch, {@code null} for the first page.
     * @return          The requested page.
     * @throws RemoteServiceException On failure.
     */
    ChildPage listChildren(String parentId, String pageToken) throws RemoteServiceException;

    /**
     * Find a child of a folder by its exact name. If several children share the name, the most recently created one
     * is returned.
     *
     * @param parentId  ID of the folder to search in.
     * @param name      Name of the child.
     * @param kind      Kind of the child, or {@code null} to match any kind.
     * @return          The matching child, if any.
     * @throws RemoteServiceException On failure.
     */
    Optional<RemoteNode> findByName(String parentId, String name, NodeKind kind) throws RemoteServiceException;

    /**
     * @return ID of the created folder.
     */
    String createFolder(String name, String parentId) throws RemoteServiceException;

    /**
     * Server-side copy of a file's content.
     *
     * @return ID of the new copy.
     */
    String copyFile(String sourceId, String destParentId, String destName) throws RemoteServiceException;
}
