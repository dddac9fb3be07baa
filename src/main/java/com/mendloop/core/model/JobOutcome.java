package com.mendloop.core.model;

/**
 * Classification of a finished job. Only {@link #SUCCEEDED} and {@link #FAILED}
 * come from a real process exit; the others are recorded by the pool itself.
 */
public enum JobOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    LAUNCH_FAILED,
    SPEC_FAILED,
    CANCELLED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
