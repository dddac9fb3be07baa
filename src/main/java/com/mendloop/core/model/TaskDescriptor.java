package com.mendloop.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One schedulable unit of work, loaded once from the manifest and never mutated.
 *
 * @param identity         unique, stable identifier (e.g. "PathViolations/UsesPathGetFullPath")
 * @param sourceLocation   path of the source file the work targets
 * @param category         grouping used in payloads and reports (e.g. "PathViolations")
 * @param originalIdentity identity used by the validation harness, for remapping failures to tasks
 */
public record TaskDescriptor(
    String identity,
    String sourceLocation,
    String category,
    String originalIdentity
) implements Serializable {

    public static final String SETUP_CATEGORY = "setup";

    public TaskDescriptor {
        Objects.requireNonNull(identity, "identity");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("Task identity must not be blank");
        }
        sourceLocation = sourceLocation != null ? sourceLocation : "";
        category = category != null ? category : "";
        originalIdentity = originalIdentity != null && !originalIdentity.isBlank() ? originalIdentity : identity;
    }

    /**
     * Synthetic descriptor for one-off jobs that serve the whole queue
     * (check harness setup, failure analysis).
     */
    public static TaskDescriptor shared(String name) {
        return new TaskDescriptor(name, "", SETUP_CATEGORY, name);
    }
}
