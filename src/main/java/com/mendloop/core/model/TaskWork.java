package com.mendloop.core.model;

import java.io.Serializable;

/**
 * The apply-work and verify-work results for one task in one iteration.
 * {@code apply} is {@code null} when the run resumed directly at verify-work.
 */
public record TaskWork(
    TaskDescriptor task,
    int queueIndex,
    JobResult apply,
    JobResult verify
) implements Serializable {

    public boolean succeeded() {
        return (apply == null || apply.succeeded()) && verify != null && verify.succeeded();
    }
}
