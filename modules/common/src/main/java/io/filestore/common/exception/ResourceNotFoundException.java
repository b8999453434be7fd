package io.filestore.common.exception;

/**
 * Base type for every "the thing you asked for does not exist" condition.
 * These are expected client-facing outcomes, not server faults.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
