package com.mendloop.core.validation;

import com.mendloop.core.model.ValidationResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * {@link ValidationHarness} returning scripted results, one per call; the last result repeats.
 */
public class ScriptedValidationHarness implements ValidationHarness {

    private final List<ValidationResult> script;
    private final List<Integer> iterations = new ArrayList<>();
    private IntFunction<RuntimeException> failure = i -> null;
    private boolean missing;

    public ScriptedValidationHarness(ValidationResult... script) {
        this.script = List.of(script);
    }

    public static ValidationResult passing(int total) {
        return new ValidationResult(total, total, 0, List.of());
    }

    public static ValidationResult failing(int total, String... names) {
        var items = new ArrayList<ValidationResult.FailedItem>();
        for (String name : names) {
            items.add(new ValidationResult.FailedItem(name, name + " still fails"));
        }
        return new ValidationResult(total, total - names.length, names.length, items);
    }

    /** Makes the harness entry point unavailable. */
    public ScriptedValidationHarness missing() {
        this.missing = true;
        return this;
    }

    /** Throws the returned exception on the given call (1-based), when non-null. */
    public ScriptedValidationHarness failOnCall(IntFunction<RuntimeException> failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public ValidationResult validate(int iteration, Path logPath) {
        if (missing) {
            throw new ValidationHarnessMissingException("Validation harness entry point not found: ./validate.sh");
        }
        iterations.add(iteration);
        RuntimeException e = failure.apply(iterations.size());
        if (e != null) {
            throw e;
        }
        return script.get(Math.min(iterations.size(), script.size()) - 1);
    }

    @Override
    public void verifyAvailable() {
        if (missing) {
            throw new ValidationHarnessMissingException("Validation harness entry point not found: ./validate.sh");
        }
    }

    /** Iterations the harness was invoked for, in call order. */
    public List<Integer> iterations() {
        return List.copyOf(iterations);
    }
}
