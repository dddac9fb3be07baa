package com.mendloop.core.phases;

/**
 * The operator aborted the run (or the controlling thread was interrupted) while a phase
 * was running. Unwinds the graph so the engine can write the ABORTED report.
 */
public class RunAbortedException extends RuntimeException {

    public RunAbortedException(String message) {
        super(message);
    }
}
