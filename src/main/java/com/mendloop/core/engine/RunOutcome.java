package com.mendloop.core.engine;

import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.ValidationResult;

/**
 * Result of one engine run, mirrored in the written report.
 *
 * @param validation last validation result, {@code null} when none ran
 * @param error      abort cause, {@code null} unless ABORTED
 */
public record RunOutcome(
    String runId,
    LoopStatus status,
    int iterations,
    ValidationResult validation,
    String reportPath,
    String error
) {

    /** 0 when validation passed, 1 when the ceiling was hit, 2 when the run aborted. */
    public int exitCode() {
        return switch (status) {
            case DONE_PASS -> 0;
            case DONE_CEILING -> 1;
            default -> 2;
        };
    }
}
