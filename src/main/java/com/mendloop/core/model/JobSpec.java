package com.mendloop.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Everything needed to launch one worker process.
 * Built fresh for every (phase, task, iteration) triple and never reused.
 *
 * @param payload          instructions handed to the worker (written to a temporary file)
 * @param workingDirectory directory the worker process starts in
 * @param logPath          file receiving the worker's stdout/stderr; unique per (phase, task, iteration)
 * @param label            human-readable job label, e.g. "apply-work:TASK-1#2"
 * @param extraContext     additional directories the worker may read
 * @param model            model/variant selector passed to the worker
 * @param timeout          per-job deadline; {@code null} uses the pool default
 */
public record JobSpec(
    String payload,
    String workingDirectory,
    String logPath,
    String label,
    List<String> extraContext,
    String model,
    Duration timeout
) {

    public JobSpec {
        extraContext = extraContext != null ? List.copyOf(extraContext) : List.of();
        workingDirectory = workingDirectory != null ? workingDirectory : ".";
    }

    public JobSpec withTimeout(Duration newTimeout) {
        return new JobSpec(payload, workingDirectory, logPath, label, extraContext, model, newTimeout);
    }
}
