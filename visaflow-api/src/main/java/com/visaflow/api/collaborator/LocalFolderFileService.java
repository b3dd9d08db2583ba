package com.visaflow.api.collaborator;

import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.exception.CollaboratorUnavailableException;
import com.visaflow.core.model.FolderItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * File service over a local directory tree.
 * Folders are directories below the storage root; folder and file ids are paths
 * relative to that root, with '/' separators. Tasks are written to the log.
 */
public class LocalFolderFileService implements FileService {

    private static final Logger log = LoggerFactory.getLogger(LocalFolderFileService.class);
    private static final String COLLABORATOR = "file service";

    private final Path root;

    public LocalFolderFileService(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<FolderItem> listFolderItems(String folderId) {
        Path folder = resolve(folderId);
        if (!Files.isDirectory(folder)) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "folder does not exist: " + folderId);
        }
        try (Stream<Path> entries = Files.list(folder)) {
            List<FolderItem> items = new ArrayList<>();
            for (Path entry : entries.sorted(Comparator.comparing(Path::toString)).toList()) {
                items.add(toItem(entry));
            }
            return items;
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "cannot list " + folderId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public FolderItem moveFile(String fileId, String targetFolderId) {
        Path source = existingFile(fileId);
        Path target = targetFolder(targetFolderId).resolve(source.getFileName());
        try {
            Files.move(source, target);
            log.info("Moved {} to {}", fileId, targetFolderId);
            return toItem(target);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "cannot move " + fileId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public FolderItem copyFile(String fileId, String targetFolderId) {
        Path source = existingFile(fileId);
        Path target = targetFolder(targetFolderId).resolve(source.getFileName());
        try {
            Files.copy(source, target);
            log.info("Copied {} to {}", fileId, targetFolderId);
            return toItem(target);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "cannot copy " + fileId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String createTask(String label, String description, String projectId) {
        String taskId = UUID.randomUUID().toString();
        log.info("Task {} for project {}: {} - {}", taskId, projectId, label, description);
        return taskId;
    }

    // ========== Helper Methods ==========

    /**
     * Resolve an id below the root. Ids escaping the root are rejected.
     */
    private Path resolve(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("folder or file id is required");
        }
        Path resolved = root.resolve(id).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("path escapes the storage root: " + id);
        }
        return resolved;
    }

    private Path existingFile(String fileId) {
        Path file = resolve(fileId);
        if (!Files.isRegularFile(file)) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "file does not exist: " + fileId);
        }
        return file;
    }

    private Path targetFolder(String folderId) {
        Path folder = resolve(folderId);
        try {
            return Files.createDirectories(folder);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "cannot create " + folderId + ": " + e.getMessage(), e);
        }
    }

    private FolderItem toItem(Path path) throws IOException {
        String id = root.relativize(path).toString().replace('\\', '/');
        String name = path.getFileName().toString();
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        if (attributes.isDirectory()) {
            return FolderItem.folder(id, name);
        }
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot + 1) : "";
        return new FolderItem(
            id,
            name,
            extension,
            attributes.size(),
            id,
            null,
            attributes.creationTime().toInstant(),
            attributes.lastModifiedTime().toInstant());
    }
}
