package com.mendloop.core.manifest;

/**
 * Raised when the task manifest is missing, unreadable or inconsistent.
 * Fatal: no phase runs without a valid manifest.
 */
public class ManifestException extends RuntimeException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
