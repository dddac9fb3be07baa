package com.mendloop.core.model;

/**
 * The named stages of the repair loop, in execution order.
 */
public enum LoopPhase {
    PROPOSE_FIX("propose-fix"),
    SCAFFOLD_CHECKS("scaffold-checks"),
    APPLY_WORK("apply-work"),
    VERIFY_WORK("verify-work"),
    RUN_VALIDATION("run-validation"),
    ANALYZE_FAILURES("analyze-failures"),
    FINALIZE("finalize");

    private final String slug;

    LoopPhase(String slug) {
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }

    /** Setup phases run once per run, before the first work iteration. */
    public boolean isSetup() {
        return this == PROPOSE_FIX || this == SCAFFOLD_CHECKS;
    }

    /**
     * Parses either the slug ("apply-work") or the enum name ("APPLY_WORK"), case-insensitively.
     */
    public static LoopPhase parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Phase must not be blank");
        }
        String normalized = raw.trim();
        for (LoopPhase phase : values()) {
            if (phase.slug.equalsIgnoreCase(normalized) || phase.name().equalsIgnoreCase(normalized)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + raw);
    }
}
