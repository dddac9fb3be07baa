package com.mendloop.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Outcome of one worker invocation. Immutable once constructed.
 *
 * @param exitCode       process exit code, or one of the sentinel codes for synthetic outcomes
 * @param outcome        classification of the exit
 * @param duration       wall-clock time from launch to collection
 * @param capturedOutput worker output (truncated, head and tail kept)
 * @param label          job label copied from the {@link JobSpec}
 * @param logPath        log file holding the full output
 * @param queueIndex     position of the task in the original queue
 * @param task           the task this job served
 */
public record JobResult(
    int exitCode,
    JobOutcome outcome,
    Duration duration,
    String capturedOutput,
    String label,
    String logPath,
    int queueIndex,
    TaskDescriptor task
) implements Serializable {

    public static final int SPEC_FAILED_EXIT_CODE = -1;
    public static final int LAUNCH_FAILED_EXIT_CODE = -2;
    public static final int TIMEOUT_EXIT_CODE = -3;
    public static final int CANCELLED_EXIT_CODE = -4;

    public JobResult {
        duration = duration != null ? duration : Duration.ZERO;
        capturedOutput = capturedOutput != null ? capturedOutput : "";
        label = label != null ? label : "";
        logPath = logPath != null ? logPath : "";
    }

    public static JobResult specFailed(String label, String message, int queueIndex, TaskDescriptor task) {
        return new JobResult(SPEC_FAILED_EXIT_CODE, JobOutcome.SPEC_FAILED, Duration.ZERO,
                message, label, "", queueIndex, task);
    }

    public static JobResult launchFailed(JobSpec spec, String message, int queueIndex, TaskDescriptor task) {
        return new JobResult(LAUNCH_FAILED_EXIT_CODE, JobOutcome.LAUNCH_FAILED, Duration.ZERO,
                message, spec.label(), spec.logPath(), queueIndex, task);
    }

    public static JobResult cancelled(String label, String logPath, Duration elapsed, int queueIndex, TaskDescriptor task) {
        return new JobResult(CANCELLED_EXIT_CODE, JobOutcome.CANCELLED, elapsed,
                "Cancelled before completion", label, logPath, queueIndex, task);
    }

    public boolean succeeded() {
        return outcome.isSuccess();
    }
}
