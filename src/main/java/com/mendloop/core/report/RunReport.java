package com.mendloop.core.report;

import com.mendloop.core.analysis.RegressionDetector.Regression;
import com.mendloop.core.model.JobOutcome;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.model.ValidationResult.FailedItem;

import java.time.Instant;
import java.util.List;

/**
 * The single written summary of a run: the source of truth for whether it succeeded.
 *
 * @param runId          run identifier
 * @param status         DONE_PASS, DONE_CEILING or ABORTED
 * @param iterations     iteration the run ended in
 * @param maxIterations  ceiling in force
 * @param validation     final validation result, {@code null} when the run aborted before validating
 * @param tasks          per-task outcomes of the last work iteration
 * @param history        one summary line per completed iteration
 * @param regressions    items that passed and later failed again
 * @param oscillating    items alternating between two failures
 * @param setupWarnings  setup failures recorded during the run
 * @param error          abort cause, {@code null} unless ABORTED
 * @param finishedAt     when the report was written
 */
public record RunReport(
    String runId,
    LoopStatus status,
    int iterations,
    int maxIterations,
    ValidationResult validation,
    List<TaskOutcome> tasks,
    List<IterationSummary> history,
    List<Regression> regressions,
    List<String> oscillating,
    List<String> setupWarnings,
    String error,
    Instant finishedAt
) {

    public RunReport {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
        regressions = regressions != null ? List.copyOf(regressions) : List.of();
        oscillating = oscillating != null ? List.copyOf(oscillating) : List.of();
        setupWarnings = setupWarnings != null ? List.copyOf(setupWarnings) : List.of();
    }

    /**
     * @param apply    apply-work outcome, {@code null} when not run in the final iteration
     * @param verify   verify-work outcome, {@code null} when not run in the final iteration
     * @param failures validation failures attributed to the task
     */
    public record TaskOutcome(
        String identity,
        String category,
        String sourceLocation,
        JobOutcome apply,
        JobOutcome verify,
        String verifyLog,
        List<FailedItem> failures
    ) {}

    public record IterationSummary(
        int iteration,
        int total,
        int passed,
        int failed,
        int tasksSucceeded,
        int tasksFailed
    ) {}
}
