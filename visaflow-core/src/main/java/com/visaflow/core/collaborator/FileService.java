package com.visaflow.core.collaborator;

import com.visaflow.core.model.FolderItem;
import java.util.List;

/**
 * File and folder operations of the host platform.
 * Implementations signal transport failures with
 * {@link com.visaflow.core.exception.CollaboratorUnavailableException}.
 */
public interface FileService {

    /**
     * List the current contents of a folder (files and sub-folders).
     */
    List<FolderItem> listFolderItems(String folderId);

    /**
     * Move a file to another folder.
     * 
     * @return The moved file
     */
    FolderItem moveFile(String fileId, String targetFolderId);

    /**
     * Copy a file to another folder.
     * 
     * @return The new copy
     */
    FolderItem copyFile(String fileId, String targetFolderId);

    /**
     * Raise a task on the project (used for notifications and comments).
     * 
     * @return The created task id
     */
    String createTask(String label, String description, String projectId);
}
