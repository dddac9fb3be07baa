package com.mendloop.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Explicit value threaded through the loop and handed to every job spec builder.
 * Carries the accumulated per-task artifacts and global guidance, and is persisted
 * in the checkpoint so a resumed run sees the same lineage.
 *
 * @param iteration       iteration the next phase runs in
 * @param plans           per-task plan text produced by propose-fix, keyed by identity
 * @param checks          per-task check artifact path produced by scaffold-checks, keyed by identity
 * @param guidance        latest guidance produced by analyze-failures (empty before the first analysis)
 * @param guidanceHistory every guidance text produced so far, oldest first
 * @param lastValidation  most recent validation result, {@code null} before the first validation
 */
public record PhaseContext(
    int iteration,
    Map<String, String> plans,
    Map<String, String> checks,
    String guidance,
    List<String> guidanceHistory,
    ValidationResult lastValidation
) implements Serializable {

    public PhaseContext {
        plans = plans != null ? Map.copyOf(plans) : Map.of();
        checks = checks != null ? Map.copyOf(checks) : Map.of();
        guidance = guidance != null ? guidance : "";
        guidanceHistory = guidanceHistory != null ? List.copyOf(guidanceHistory) : List.of();
    }

    public static PhaseContext initial(int iteration) {
        return new PhaseContext(iteration, Map.of(), Map.of(), "", List.of(), null);
    }

    public PhaseContext withIteration(int newIteration) {
        return new PhaseContext(newIteration, plans, checks, guidance, guidanceHistory, lastValidation);
    }

    public PhaseContext withPlans(Map<String, String> newPlans) {
        return new PhaseContext(iteration, newPlans, checks, guidance, guidanceHistory, lastValidation);
    }

    public PhaseContext withChecks(Map<String, String> newChecks) {
        return new PhaseContext(iteration, plans, newChecks, guidance, guidanceHistory, lastValidation);
    }

    public PhaseContext withGuidance(String newGuidance) {
        var history = new ArrayList<>(guidanceHistory);
        history.add(newGuidance);
        return new PhaseContext(iteration, plans, checks, newGuidance, history, lastValidation);
    }

    public PhaseContext withLastValidation(ValidationResult validation) {
        return new PhaseContext(iteration, plans, checks, guidance, guidanceHistory, validation);
    }

    public String planFor(String identity) {
        return plans.getOrDefault(identity, "");
    }

    public String checkFor(String identity) {
        return checks.getOrDefault(identity, "");
    }
}
