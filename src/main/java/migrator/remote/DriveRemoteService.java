package migrator.remote;

import migrator.Config;
import migrator.Util;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteService} backed by the Drive v3 API. Shared drives are supported on every call.
 */
public class DriveRemoteService implements RemoteService {
    private static final String NODE_FIELDS = "id, name, mimeType, size, md5Checksum";
    private static final String LIST_FIELDS = "nextPageToken, files(" + NODE_FIELDS + ")";

    private final Drive drive;

    public DriveRemoteService(Drive driveService) {
        Objects.requireNonNull(driveService, "Drive service may not be null");
        this.drive = driveService;
    }

    @Override
    public Optional<RemoteNode> getMetadata(String id) throws RemoteServiceException {
        try {
            File file = drive.files().get(id)
                    .setFields(NODE_FIELDS)
                    .setSupportsAllDrives(true)
                    .execute();
            return Optional.of(toNode(file));
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw DriveErrors.wrap("Getting metadata of " + id, e);
        } catch (IOException e) {
            throw DriveErrors.wrap("Getting metadata of " + id, e);
        }
    }

    @Override
    public ChildPage listChildren(String parentId, String pageToken) throws RemoteServiceException {
        try {
            FileList result = drive.files().list()
                    .setQ("'" + parentId + "' in parents and trashed = false")
                    .setFields(LIST_FIELDS)
                    .setOrderBy("name,createdTime")     // Same-named siblings come oldest first, newest last
                    .setPageToken(pageToken)
                    .setPageSize(Config.MAX_PAGE_SIZE)
                    .setSpaces("drive")
                    .setSupportsAllDrives(true)
                    .setIncludeItemsFromAllDrives(true)
                    .execute();
            return new ChildPage(toNodes(result.getFiles()), result.getNextPageToken());
        } catch (IOException e) {
            throw DriveErrors.wrap("Listing children of " + parentId, e);
        }
    }

    @Override
    public Optional<RemoteNode> findByName(String parentId, String name, NodeKind kind) throws RemoteServiceException {
        StringBuilder query = new StringBuilder("name = '").append(Util.escapeQueryValue(name)).append("'")
                .append(" and '").append(parentId).append("' in parents and trashed = false");
        if (kind == NodeKind.FOLDER) {
            query.append(" and mimeType = '").append(Util.FOLDER_MIME_TYPE).append("'");
        } else if (kind == NodeKind.FILE) {
            query.append(" and mimeType != '").append(Util.FOLDER_MIME_TYPE).append("'");
        }
        try {
            FileList result = drive.files().list()
                    .setQ(query.toString())
                    .setFields("files(" + NODE_FIELDS + ")")
                    .setOrderBy("createdTime desc")
                    .setSpaces("drive")
                    .setSupportsAllDrives(true)
                    .setIncludeItemsFromAllDrives(true)
                    .execute();
            return toNodes(result.getFiles()).stream().findFirst();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404) {
                // Parent not found
                return Optional.empty();
            }
            throw DriveErrors.wrap("Finding " + name + " in " + parentId, e);
        } catch (IOException e) {
            throw DriveErrors.wrap("Finding " + name + " in " + parentId, e);
        }
    }

    @Override
    public String createFolder(String name, String parentId) throws RemoteServiceException {
        // https://developers.google.com/drive/api/guides/folder
        File fileMetadata = new File();
        fileMetadata.setName(name);
        fileMetadata.setMimeType(Util.FOLDER_MIME_TYPE);
        fileMetadata.setParents(Collections.singletonList(parentId));
        try {
            return drive.files().create(fileMetadata)
                    .setFields("id")
                    .setSupportsAllDrives(true)
                    .execute()
                    .getId();
        } catch (IOException e) {
            throw DriveErrors.wrap("Creating folder " + name + " in " + parentId, e);
        }
    }

    @Override
    public String copyFile(String sourceId, String destParentId, String destName) throws RemoteServiceException {
        File copyMetadata = new File();
        copyMetadata.setName(destName);
        copyMetadata.setParents(Collections.singletonList(destParentId));
        try {
            return drive.files().copy(sourceId, copyMetadata)
                    .setFields("id")
                    .setSupportsAllDrives(true)
                    .execute()
                    .getId();
        } catch (IOException e) {
            throw DriveErrors.wrap("Copying " + sourceId + " to " + destParentId, e);
        }
    }

    private static List<RemoteNode> toNodes(List<File> files) {
        List<RemoteNode> result = new ArrayList<>();
        if (files != null) {
            for (File file : files) {
                result.add(toNode(file));
            }
        }
        return result;
    }

    static RemoteNode toNode(File file) {
        if (Util.isFolder(file.getMimeType())) {
            return RemoteNode.folder(file.getId(), file.getName());
        }
        long size = Optional.ofNullable(file.getSize()).orElse(0L);
        return RemoteNode.file(file.getId(), file.getName(), file.getMimeType(), size, file.getMd5Checksum());
    }
}
