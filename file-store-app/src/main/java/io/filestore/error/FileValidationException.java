package io.filestore.error;

/**
 * The request itself is not acceptable, e.g. the upload carries no file.
 */
public class FileValidationException extends RuntimeException {
    private final ErrorCode code;

    public FileValidationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
