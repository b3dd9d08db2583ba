package com.visaflow.engine.invoke;

import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.model.FolderItem;

import java.util.List;

/**
 * File service whose calls run through a {@link CollaboratorInvoker}, so each one has
 * the invoker's deadline. A call that times out surfaces as
 * {@link com.visaflow.core.exception.CollaboratorUnavailableException}; the underlying
 * operation may still complete on its own.
 */
public class InvokingFileService implements FileService {

    static final String FILE_SERVICE = "file service";

    private final FileService delegate;
    private final CollaboratorInvoker invoker;

    public InvokingFileService(FileService delegate, CollaboratorInvoker invoker) {
        this.delegate = delegate;
        this.invoker = invoker;
    }

    @Override
    public List<FolderItem> listFolderItems(String folderId) {
        return invoker.call(FILE_SERVICE, () -> delegate.listFolderItems(folderId));
    }

    @Override
    public FolderItem moveFile(String fileId, String targetFolderId) {
        return invoker.call(FILE_SERVICE, () -> delegate.moveFile(fileId, targetFolderId));
    }

    @Override
    public FolderItem copyFile(String fileId, String targetFolderId) {
        return invoker.call(FILE_SERVICE, () -> delegate.copyFile(fileId, targetFolderId));
    }

    @Override
    public String createTask(String label, String description, String projectId) {
        return invoker.call(FILE_SERVICE, () -> delegate.createTask(label, description, projectId));
    }
}
