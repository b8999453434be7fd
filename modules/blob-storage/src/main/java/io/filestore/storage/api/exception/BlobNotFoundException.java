package io.filestore.storage.api.exception;

import io.filestore.common.exception.ResourceNotFoundException;

public class BlobNotFoundException extends ResourceNotFoundException {
    private final String fileKey;

    public BlobNotFoundException(String fileKey) {
        super("No blob stored under key: " + fileKey);
        this.fileKey = fileKey;
    }

    public String getFileKey() {
        return fileKey;
    }
}
