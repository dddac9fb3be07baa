package com.mendloop.core.model;

import java.io.Serializable;

/**
 * Where a run (re-)enters the loop. Phases before this point in the same
 * iteration are skipped and their durable outputs are reused.
 */
public record ResumePoint(LoopPhase phase, int iteration) implements Serializable {

    public ResumePoint {
        if (phase == null) {
            throw new IllegalArgumentException("Resume phase must not be null");
        }
        if (iteration < 1) {
            throw new IllegalArgumentException("Resume iteration must be >= 1, was " + iteration);
        }
    }

    public static ResumePoint fresh() {
        return new ResumePoint(LoopPhase.PROPOSE_FIX, 1);
    }

    /**
     * True when {@code phase} in {@code atIteration} happens before this resume point.
     */
    public boolean skips(LoopPhase candidate, int atIteration) {
        if (atIteration != iteration) {
            return atIteration < iteration;
        }
        return candidate.ordinal() < phase.ordinal();
    }

    /** True when the setup phases are entered after iteration 1, so their artifacts must be regenerated. */
    public boolean regeneratesSetup() {
        return iteration > 1 && phase.isSetup();
    }
}
