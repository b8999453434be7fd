package io.filestore.storage.api.exception;

public class SizeLimitExceededException extends StorageException {
    private final long sizeLimit;

    public SizeLimitExceededException(long sizeLimit) {
        super("File exceeds the maximum allowed size of " + sizeLimit + " bytes");
        this.sizeLimit = sizeLimit;
    }

    public long getSizeLimit() {
        return sizeLimit;
    }
}
