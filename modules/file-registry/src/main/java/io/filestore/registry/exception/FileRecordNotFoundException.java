package io.filestore.registry.exception;

import io.filestore.common.exception.ResourceNotFoundException;

public class FileRecordNotFoundException extends ResourceNotFoundException {
    private final String fileId;

    public FileRecordNotFoundException(String fileId) {
        super("File not found: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
