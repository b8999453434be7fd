package io.filestore.error;

import io.filestore.common.exception.ResourceNotFoundException;
import io.filestore.storage.api.exception.SizeLimitExceededException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Wraps an unexpected failure of an API operation together with the operation's error code.
 */
public class ApiOperationException extends RuntimeException {
    private final ErrorCode code;

    public ApiOperationException(ErrorCode code, Throwable cause) {
        super(code.name() + ": " + cause.getMessage(), cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Everything that is not one of the expected client facing outcomes.
     */
    public static boolean isUnexpected(Throwable error) {
        return !(error instanceof ResourceNotFoundException
                || error instanceof FileValidationException
                || error instanceof SizeLimitExceededException
                || error instanceof FileMissingException
                || error instanceof ResponseStatusException
                || error instanceof ApiOperationException);
    }
}
