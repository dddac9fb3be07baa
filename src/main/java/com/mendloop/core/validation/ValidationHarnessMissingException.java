package com.mendloop.core.validation;

/**
 * The validation harness entry point cannot be found or started. Fatal for the run:
 * without a harness no iteration can produce a meaningful signal.
 */
public class ValidationHarnessMissingException extends RuntimeException {

    public ValidationHarnessMissingException(String message) {
        super(message);
    }

    public ValidationHarnessMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
