package com.mendloop.core.analysis;

import com.mendloop.core.analysis.RegressionDetector.Regression;
import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.model.ValidationResult.FailedItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegressionDetectorTest {

    private RegressionDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RegressionDetector();
    }

    private static IterationState iteration(int i, int total, FailedItem... failures) {
        return new IterationState(i, List.of(),
                new ValidationResult(total, total - failures.length, failures.length, List.of(failures)));
    }

    private static FailedItem fail(String name, String message) {
        return new FailedItem(name, message);
    }

    @Test
    @DisplayName("no regressions with a single iteration")
    void singleIteration() {
        assertTrue(detector.regressions(List.of(iteration(1, 3, fail("A", "x")))).isEmpty());
    }

    @Test
    @DisplayName("an item failing now that passed before is a regression")
    void detectsRegression() {
        var history = List.of(
                iteration(1, 3, fail("A", "x")),
                iteration(2, 3, fail("B", "broke B")));

        List<Regression> regressions = detector.regressions(history);

        assertEquals(List.of(new Regression("B", 2, "broke B")), regressions);
    }

    @Test
    @DisplayName("items still failing are not regressions")
    void stillFailing() {
        var history = List.of(
                iteration(1, 3, fail("A", "x")),
                iteration(2, 3, fail("A", "y")));

        assertTrue(detector.regressions(history).isEmpty());
    }

    @Test
    @DisplayName("nothing regresses after an unusable validation")
    void unusablePrevious() {
        var previous = new IterationState(1, List.of(), ValidationResult.unusable("no report"));
        var current = iteration(2, 3, fail("A", "x"));

        assertTrue(detector.regressionsBetween(previous, current).isEmpty());
    }

    @Test
    @DisplayName("A-B-A failure messages oscillate")
    void oscillation() {
        var history = List.of(
                iteration(1, 2, fail("A", "Error A"), fail("B", "same")),
                iteration(2, 2, fail("A", "Error B"), fail("B", "same")),
                iteration(3, 2, fail("A", "Error A"), fail("B", "same")));

        assertEquals(List.of("A"), detector.oscillating(history));
    }

    @Test
    @DisplayName("A-B-C is not oscillation")
    void noOscillation() {
        var history = List.of(
                iteration(1, 1, fail("A", "Error A")),
                iteration(2, 1, fail("A", "Error B")),
                iteration(3, 1, fail("A", "Error C")));

        assertTrue(detector.oscillating(history).isEmpty());
    }
}
