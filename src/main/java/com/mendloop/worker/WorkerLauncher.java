package com.mendloop.worker;

import com.mendloop.core.model.JobSpec;

import java.io.IOException;

/**
 * Starts worker processes. Implementations: {@link LocalProcessLauncher} (child processes);
 * tests inject fakes so the pool and the phases run without real processes.
 */
public interface WorkerLauncher {

    /**
     * Starts the worker described by {@code spec} and returns immediately.
     *
     * @throws IOException when the process cannot be started
     */
    WorkerProcess launch(JobSpec spec) throws IOException;

    /**
     * True when the worker executable can be resolved. Used for the preflight warning only.
     */
    default boolean isAvailable() {
        return true;
    }
}
