package com.mendloop.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("TaskDescriptor")
    class TaskDescriptorTests {

        @Test
        @DisplayName("rejects blank identity")
        void rejectsBlankIdentity() {
            assertThrows(IllegalArgumentException.class, () -> new TaskDescriptor(" ", "a.cs", "c", null));
            assertThrows(NullPointerException.class, () -> new TaskDescriptor(null, "a.cs", "c", null));
        }

        @Test
        @DisplayName("shared descriptor uses the setup category")
        void sharedDescriptor() {
            var task = TaskDescriptor.shared("failure-analysis");
            assertEquals(TaskDescriptor.SETUP_CATEGORY, task.category());
            assertEquals("failure-analysis", task.originalIdentity());
        }
    }

    @Nested
    @DisplayName("LoopPhase")
    class LoopPhaseTests {

        @Test
        @DisplayName("parses slugs and enum names")
        void parses() {
            assertEquals(LoopPhase.APPLY_WORK, LoopPhase.parse("apply-work"));
            assertEquals(LoopPhase.APPLY_WORK, LoopPhase.parse("APPLY_WORK"));
            assertEquals(LoopPhase.RUN_VALIDATION, LoopPhase.parse(" Run-Validation "));
            assertThrows(IllegalArgumentException.class, () -> LoopPhase.parse("deploy"));
            assertThrows(IllegalArgumentException.class, () -> LoopPhase.parse(""));
        }

        @Test
        @DisplayName("only propose-fix and scaffold-checks are setup phases")
        void setupPhases() {
            assertTrue(LoopPhase.PROPOSE_FIX.isSetup());
            assertTrue(LoopPhase.SCAFFOLD_CHECKS.isSetup());
            assertFalse(LoopPhase.APPLY_WORK.isSetup());
        }
    }

    @Nested
    @DisplayName("ResumePoint")
    class ResumePointTests {

        @Test
        @DisplayName("skips earlier phases of the same iteration")
        void skipsEarlierPhases() {
            var point = new ResumePoint(LoopPhase.RUN_VALIDATION, 2);

            assertTrue(point.skips(LoopPhase.APPLY_WORK, 2));
            assertTrue(point.skips(LoopPhase.VERIFY_WORK, 2));
            assertFalse(point.skips(LoopPhase.RUN_VALIDATION, 2));
            assertFalse(point.skips(LoopPhase.ANALYZE_FAILURES, 2));
        }

        @Test
        @DisplayName("skips everything in earlier iterations and nothing in later ones")
        void iterationOrdering() {
            var point = new ResumePoint(LoopPhase.APPLY_WORK, 2);

            assertTrue(point.skips(LoopPhase.PROPOSE_FIX, 1));
            assertTrue(point.skips(LoopPhase.ANALYZE_FAILURES, 1));
            assertFalse(point.skips(LoopPhase.APPLY_WORK, 3));
        }

        @Test
        @DisplayName("fresh start skips nothing")
        void freshSkipsNothing() {
            for (LoopPhase phase : LoopPhase.values()) {
                assertFalse(ResumePoint.fresh().skips(phase, 1));
            }
        }

        @Test
        @DisplayName("setup after iteration 1 regenerates artifacts")
        void regeneratesSetup() {
            assertTrue(new ResumePoint(LoopPhase.PROPOSE_FIX, 3).regeneratesSetup());
            assertFalse(new ResumePoint(LoopPhase.PROPOSE_FIX, 1).regeneratesSetup());
            assertFalse(new ResumePoint(LoopPhase.APPLY_WORK, 3).regeneratesSetup());
        }

        @Test
        @DisplayName("rejects iteration below 1")
        void rejectsIterationZero() {
            assertThrows(IllegalArgumentException.class, () -> new ResumePoint(LoopPhase.APPLY_WORK, 0));
        }
    }

    @Nested
    @DisplayName("LoopCheckpoint")
    class LoopCheckpointTests {

        private LoopCheckpoint after(LoopPhase phase, LoopStatus status) {
            return new LoopCheckpoint("MEND-2026-0001", status, phase, 2, 5, PhaseContext.initial(2),
                    null, null, null, Instant.now());
        }

        @Test
        @DisplayName("resumes at the phase after the completed one")
        void nextResumePoint() {
            assertEquals(new ResumePoint(LoopPhase.SCAFFOLD_CHECKS, 2),
                    after(LoopPhase.PROPOSE_FIX, LoopStatus.SETUP).nextResumePoint());
            assertEquals(new ResumePoint(LoopPhase.APPLY_WORK, 2),
                    after(LoopPhase.SCAFFOLD_CHECKS, LoopStatus.WORKING).nextResumePoint());
            assertEquals(new ResumePoint(LoopPhase.RUN_VALIDATION, 2),
                    after(LoopPhase.VERIFY_WORK, LoopStatus.EVALUATING).nextResumePoint());
            assertEquals(new ResumePoint(LoopPhase.ANALYZE_FAILURES, 2),
                    after(LoopPhase.RUN_VALIDATION, LoopStatus.ANALYZING).nextResumePoint());
            assertEquals(new ResumePoint(LoopPhase.FINALIZE, 2),
                    after(LoopPhase.RUN_VALIDATION, LoopStatus.DONE_CEILING).nextResumePoint());
            assertEquals(new ResumePoint(LoopPhase.APPLY_WORK, 2),
                    after(LoopPhase.ANALYZE_FAILURES, LoopStatus.WORKING).nextResumePoint());
        }

        @Test
        @DisplayName("null lists become empty")
        void nullListsEmpty() {
            var checkpoint = after(LoopPhase.PROPOSE_FIX, LoopStatus.SETUP);
            assertTrue(checkpoint.history().isEmpty());
            assertTrue(checkpoint.currentWork().isEmpty());
            assertTrue(checkpoint.setupWarnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("ValidationResult")
    class ValidationResultTests {

        @Test
        @DisplayName("converges only when something ran and nothing failed")
        void convergence() {
            assertTrue(new ValidationResult(3, 3, 0, List.of()).converged());
            assertFalse(new ValidationResult(3, 2, 1, List.of()).converged());
            assertFalse(new ValidationResult(0, 0, 0, List.of()).converged());
            assertFalse(ValidationResult.unusable("no report").converged());
        }

        @Test
        @DisplayName("unusable result carries one synthetic failure")
        void unusable() {
            var result = ValidationResult.unusable("report missing");
            assertEquals(1, result.failedItems().size());
            assertEquals("report missing", result.failedItems().get(0).message());
        }

        @Test
        @DisplayName("failuresFor matches identity or original identity")
        void failuresFor() {
            var result = new ValidationResult(3, 1, 2, List.of(
                    new ValidationResult.FailedItem("Expander_UsesPathGetFullPath", "still relative"),
                    new ValidationResult.FailedItem("Other_Test", "broken")));
            var task = new TaskDescriptor("PathViolations/UsesPathGetFullPath", "Expander.cs", "PathViolations",
                    "Expander_UsesPathGetFullPath");

            assertEquals(1, result.failuresFor(task).size());
            assertTrue(result.failuresFor(new TaskDescriptor("Unrelated", "", "", null)).isEmpty());
        }

        @Test
        @DisplayName("failuresFor matches whole tokens only")
        void failuresForTokenBoundary() {
            var result = new ValidationResult(4, 1, 3, List.of(
                    new ValidationResult.FailedItem("A10_Test", "broken"),
                    new ValidationResult.FailedItem("A1_Test", "broken"),
                    new ValidationResult.FailedItem("Suite.A1", "broken")));

            var names = result.failuresFor(new TaskDescriptor("A1", "", "", null)).stream()
                    .map(ValidationResult.FailedItem::name).toList();

            assertEquals(List.of("A1_Test", "Suite.A1"), names);
            assertEquals(1, result.failuresFor(new TaskDescriptor("A10", "", "", null)).size());
            assertTrue(result.failuresFor(new TaskDescriptor("A", "", "", null)).isEmpty());
        }
    }

    @Nested
    @DisplayName("PhaseContext")
    class PhaseContextTests {

        @Test
        @DisplayName("withGuidance records history in order")
        void guidanceHistory() {
            var context = PhaseContext.initial(1).withGuidance("first").withGuidance("second");

            assertEquals("second", context.guidance());
            assertEquals(List.of("first", "second"), context.guidanceHistory());
        }

        @Test
        @DisplayName("lookups default to empty strings")
        void lookups() {
            var context = PhaseContext.initial(1).withPlans(Map.of("A", "plan A")).withChecks(Map.of("A", "/checks/A"));

            assertEquals("plan A", context.planFor("A"));
            assertEquals("", context.planFor("B"));
            assertEquals("/checks/A", context.checkFor("A"));
            assertEquals("", context.checkFor("B"));
        }

        @Test
        @DisplayName("copies are immutable")
        void immutable() {
            var context = PhaseContext.initial(1).withPlans(Map.of("A", "plan"));
            assertThrows(UnsupportedOperationException.class, () -> context.plans().put("B", "x"));
        }
    }

    @Nested
    @DisplayName("JobResult")
    class JobResultTests {

        @Test
        @DisplayName("synthetic results use sentinel exit codes")
        void sentinels() {
            var task = new TaskDescriptor("A", "", "", null);
            assertEquals(-1, JobResult.specFailed("apply:A", "boom", 0, task).exitCode());
            assertEquals(-4, JobResult.cancelled("apply:A", "", null, 0, task).exitCode());
            assertFalse(JobResult.cancelled("apply:A", "", null, 0, task).succeeded());
        }
    }
}
