package com.mendloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregate pass/fail signal produced by the external validation harness.
 * The sole input to the loop's continue/stop decision.
 */
public record ValidationResult(
    int total,
    int passed,
    int failed,
    List<FailedItem> failedItems
) implements Serializable {

    public ValidationResult {
        failedItems = failedItems != null ? List.copyOf(failedItems) : List.of();
    }

    /**
     * A single named failure reported by the harness.
     */
    public record FailedItem(String name, String message) implements Serializable {}

    /**
     * Non-converged result carrying one synthetic failure, used when the harness ran
     * but produced no usable report.
     */
    public static ValidationResult unusable(String reason) {
        return new ValidationResult(0, 0, 0, List.of(new FailedItem("validation-harness", reason)));
    }

    /**
     * The terminal success condition: nothing failed and something was actually run.
     */
    public boolean converged() {
        return failed == 0 && total > 0;
    }

    /**
     * Failures whose name mentions the task's identity or original identity as a whole token:
     * {@code A1} matches {@code A1_Test} and {@code Suite.A1} but not {@code A10_Test}.
     */
    public List<FailedItem> failuresFor(TaskDescriptor task) {
        return failedItems.stream()
                .filter(f -> f.name() != null
                        && (mentions(f.name(), task.originalIdentity()) || mentions(f.name(), task.identity())))
                .toList();
    }

    static boolean mentions(String name, String token) {
        for (int at = name.indexOf(token); at >= 0; at = name.indexOf(token, at + 1)) {
            int end = at + token.length();
            if ((at == 0 || !Character.isLetterOrDigit(name.charAt(at - 1)))
                    && (end == name.length() || !Character.isLetterOrDigit(name.charAt(end)))) {
                return true;
            }
        }
        return false;
    }
}
