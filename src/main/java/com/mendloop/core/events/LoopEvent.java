package com.mendloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the loop runs, used for CLI progress output.
 *
 * @param eventType event type (e.g. "run.started", "phase.started", "job.completed")
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run- and phase-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record LoopEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static LoopEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new LoopEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
