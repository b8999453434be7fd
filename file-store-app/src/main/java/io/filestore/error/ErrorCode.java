package io.filestore.error;

import org.springframework.http.HttpStatus;

/**
 * Machine readable codes sent in the {@code code} field of every error body.
 */
public enum ErrorCode {
    NO_FILE(HttpStatus.BAD_REQUEST),
    UNEXPECTED_FILE(HttpStatus.BAD_REQUEST),
    INVALID_UPLOAD(HttpStatus.BAD_REQUEST),
    REQUEST_ERROR(HttpStatus.BAD_REQUEST),
    FILE_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FILE_MISSING(HttpStatus.NOT_FOUND),
    UPLOAD_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    FILES_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    DOWNLOAD_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    DELETE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    CLEAR_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
