package io.filestore.error;

/**
 * A file is registered but its blob is gone. Unlike an unknown id this points at an
 * inconsistency on the server.
 */
public class FileMissingException extends RuntimeException {
    private final String fileId;

    public FileMissingException(String fileId, Throwable cause) {
        super("Blob missing for registered file " + fileId, cause);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
