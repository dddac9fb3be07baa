package com.mendloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Everything one iteration produced. Superseded, never deleted, by the next iteration's state.
 */
public record IterationState(
    int iteration,
    List<TaskWork> work,
    ValidationResult validation
) implements Serializable {

    public IterationState {
        work = work != null ? List.copyOf(work) : List.of();
    }
}
