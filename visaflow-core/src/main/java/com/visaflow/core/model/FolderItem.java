package com.visaflow.core.model;

import java.time.Instant;

/**
 * Entry of a folder listing returned by the file service.
 * Sub-folders carry no extension.
 */
public record FolderItem(
    String id,
    String name,
    String extension,
    Long size,
    String path,
    String uploadedBy,
    Instant uploadedAt,
    Instant lastModified
) {
    public static FolderItem file(String id, String name, String extension) {
        return new FolderItem(id, name, extension, null, null, null, null, null);
    }

    public static FolderItem folder(String id, String name) {
        return new FolderItem(id, name, null, null, null, null, null, null);
    }

    public boolean isFile() {
        return extension != null;
    }
}
