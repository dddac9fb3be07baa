package com.mendloop.core.artifacts;

/**
 * Raised when a durable artifact (checkpoint, report, plan, guidance) cannot be read or written.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
