package io.filestore.web;

import io.filestore.error.ApiOperationException;
import io.filestore.error.ErrorCode;
import io.filestore.error.FileMissingException;
import io.filestore.error.FileValidationException;
import io.filestore.registry.exception.FileRecordNotFoundException;
import io.filestore.storage.api.exception.SizeLimitExceededException;
import io.filestore.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Turns every failure into a structured {@code {error, code}} body. Client errors are only
 * logged at debug level; consistency and internal faults are logged with their cause, but
 * the response never carries more than a generic message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FileValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(FileValidationException ex) {
        log.debug("Rejected upload: {}", ex.getMessage());
        return ResponseEntity.status(ex.getCode().getStatus())
                .body(ErrorResponse.of(ex.getMessage(), ex.getCode()));
    }

    @ExceptionHandler(SizeLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleSizeLimit(SizeLimitExceededException ex) {
        log.debug("Rejected oversized upload: {}", ex.getMessage());
        return ResponseEntity.status(ErrorCode.FILE_TOO_LARGE.getStatus())
                .body(ErrorResponse.tooLarge(ex.getMessage(), ex.getSizeLimit()));
    }

    @ExceptionHandler(FileRecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(FileRecordNotFoundException ex) {
        log.debug("Unknown file id: {}", ex.getFileId());
        return ResponseEntity.status(ErrorCode.NOT_FOUND.getStatus())
                .body(ErrorResponse.forFile("File not found", ErrorCode.NOT_FOUND, ex.getFileId()));
    }

    @ExceptionHandler(FileMissingException.class)
    public ResponseEntity<ErrorResponse> handleFileMissing(FileMissingException ex) {
        log.error("Consistency fault on download of file {}: record exists but blob is missing", ex.getFileId(), ex);
        return ResponseEntity.status(ErrorCode.FILE_MISSING.getStatus())
                .body(ErrorResponse.forFile("File not found on server", ErrorCode.FILE_MISSING, ex.getFileId()));
    }

    @ExceptionHandler(ApiOperationException.class)
    public ResponseEntity<ErrorResponse> handleOperationFailure(ApiOperationException ex) {
        log.error("Operation failed with {}", ex.getCode(), ex.getCause());
        return ResponseEntity.status(ex.getCode().getStatus())
                .body(ErrorResponse.of("Internal server error", ex.getCode()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        log.debug("Request failed with status {}: {}", ex.getStatusCode(), ex.getReason());
        String reason = ex.getReason() != null ? ex.getReason() : "Request could not be processed";
        ErrorCode code = ex.getStatusCode().is4xxClientError() ? ErrorCode.REQUEST_ERROR : ErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorResponse.of(reason, code));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.getStatus())
                .body(ErrorResponse.of("Something went wrong!", ErrorCode.INTERNAL_ERROR));
    }
}
