package com.mendloop.core.analysis;

import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.model.ValidationResult.FailedItem;
import org.springframework.stereotype.Service;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks validation items across iterations.
 *
 * <p>A <em>regression</em> is an item failing in iteration {@code i} that did not fail in
 * iteration {@code i - 1}. An item <em>oscillates</em> when its failure messages alternate
 * between two distinct errors (A-B-A). Works purely over the recorded history, so the
 * answer is the same after a resume.
 */
@Service
public class RegressionDetector {

    public record Regression(String name, int iteration, String message) implements Serializable {}

    public List<Regression> regressions(List<IterationState> history) {
        var found = new ArrayList<Regression>();
        for (int i = 1; i < history.size(); i++) {
            found.addAll(regressionsBetween(history.get(i - 1), history.get(i)));
        }
        return found;
    }

    /**
     * Items failing in {@code current} that passed in {@code previous}. Empty when the
     * previous validation produced no usable report, since nothing is known to have passed.
     */
    public List<Regression> regressionsBetween(IterationState previous, IterationState current) {
        ValidationResult before = previous.validation();
        ValidationResult after = current.validation();
        if (before == null || after == null || before.total() == 0) {
            return List.of();
        }
        Set<String> failedBefore = new LinkedHashSet<>();
        before.failedItems().forEach(f -> failedBefore.add(f.name()));
        var found = new ArrayList<Regression>();
        for (FailedItem item : after.failedItems()) {
            if (!failedBefore.contains(item.name())) {
                found.add(new Regression(item.name(), current.iteration(), item.message()));
            }
        }
        return found;
    }

    /**
     * Names of items whose consecutive failure messages show an A-B-A pattern.
     */
    public List<String> oscillating(List<IterationState> history) {
        Map<String, List<String>> messages = new LinkedHashMap<>();
        for (IterationState state : history) {
            if (state.validation() == null) {
                continue;
            }
            for (FailedItem item : state.validation().failedItems()) {
                messages.computeIfAbsent(item.name(), k -> new ArrayList<>())
                        .add(item.message() != null ? item.message() : "");
            }
        }
        var found = new ArrayList<String>();
        messages.forEach((name, errors) -> {
            if (alternates(errors)) {
                found.add(name);
            }
        });
        return found;
    }

    private static boolean alternates(List<String> errors) {
        // error[N] matches error[N-2] but differs from error[N-1]
        for (int i = 2; i < errors.size(); i++) {
            String current = errors.get(i);
            if (current.equals(errors.get(i - 2)) && !current.equals(errors.get(i - 1))) {
                return true;
            }
        }
        return false;
    }
}
