package com.mendloop.core.validation;

import com.mendloop.core.model.ValidationResult;

import java.nio.file.Path;

/**
 * The external, whole-queue pass/fail gate. Invoked once per iteration.
 */
public interface ValidationHarness {

    /**
     * Runs the harness and returns its aggregate result. A harness that ran but produced
     * no usable report yields {@link ValidationResult#unusable(String)}.
     *
     * @param iteration the iteration being evaluated
     * @param logPath   file receiving the harness output
     * @throws ValidationHarnessMissingException when the harness cannot be started at all
     */
    ValidationResult validate(int iteration, Path logPath);

    /**
     * Fails fast, before any phase runs, when the harness entry point is absent.
     *
     * @throws ValidationHarnessMissingException when the entry point cannot be resolved
     */
    void verifyAvailable();
}
