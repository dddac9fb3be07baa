package com.mendloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Durable snapshot written after every phase so a restarted process can resume.
 *
 * @param runId          the run that wrote the checkpoint
 * @param status         loop status after the phase
 * @param completedPhase the phase that just finished
 * @param iteration      iteration the next phase runs in
 * @param maxIterations  ceiling in force for the run
 * @param context        phase context after the phase
 * @param currentWork    work results of the current iteration so far
 * @param history        every completed iteration, oldest first
 * @param setupWarnings  setup failures recorded so far
 * @param updatedAt      when the checkpoint was written
 */
public record LoopCheckpoint(
    String runId,
    LoopStatus status,
    LoopPhase completedPhase,
    int iteration,
    int maxIterations,
    PhaseContext context,
    List<TaskWork> currentWork,
    List<IterationState> history,
    List<String> setupWarnings,
    Instant updatedAt
) implements Serializable {

    public LoopCheckpoint {
        currentWork = currentWork != null ? List.copyOf(currentWork) : List.of();
        history = history != null ? List.copyOf(history) : List.of();
        setupWarnings = setupWarnings != null ? List.copyOf(setupWarnings) : List.of();
    }

    /**
     * The point a resumed run continues from: the phase after {@link #completedPhase}.
     */
    public ResumePoint nextResumePoint() {
        return switch (completedPhase) {
            case PROPOSE_FIX -> new ResumePoint(LoopPhase.SCAFFOLD_CHECKS, iteration);
            case SCAFFOLD_CHECKS, ANALYZE_FAILURES -> new ResumePoint(LoopPhase.APPLY_WORK, iteration);
            case APPLY_WORK, VERIFY_WORK -> new ResumePoint(LoopPhase.RUN_VALIDATION, iteration);
            case RUN_VALIDATION -> status.isTerminal()
                    ? new ResumePoint(LoopPhase.FINALIZE, iteration)
                    : new ResumePoint(LoopPhase.ANALYZE_FAILURES, iteration);
            case FINALIZE -> new ResumePoint(LoopPhase.FINALIZE, iteration);
        };
    }
}
