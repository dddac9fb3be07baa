package com.mendloop.core.artifacts;

import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.JobOutcome;
import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {

    @TempDir
    Path root;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(root);
        store.prepare();
    }

    @Test
    @DisplayName("log paths are unique per phase, task and iteration")
    void uniqueLogPaths() {
        var paths = new HashSet<Path>();
        for (LoopPhase phase : List.of(LoopPhase.APPLY_WORK, LoopPhase.VERIFY_WORK)) {
            for (String id : List.of("PathViolations/A", "PathViolations_A", "PathViolations%2FA")) {
                for (int i = 1; i <= 2; i++) {
                    assertTrue(paths.add(store.logPath(phase, id, i)));
                }
            }
        }
        assertEquals(12, paths.size());
    }

    @Test
    @DisplayName("shared job logs never collide with a task of the same name")
    void sharedLogsApart() {
        for (String name : List.of("check-harness", "failure-analysis", "_shared/check-harness")) {
            assertNotEquals(store.sharedLogPath(LoopPhase.SCAFFOLD_CHECKS, "check-harness", 1),
                    store.logPath(LoopPhase.SCAFFOLD_CHECKS, name, 1));
        }
        assertEquals("_shared", store.sharedLogPath(LoopPhase.ANALYZE_FAILURES, "failure-analysis", 2)
                .getParent().getFileName().toString());
    }

    @Test
    @DisplayName("harness notes never count as a task's check")
    void harnessNotesApart() throws Exception {
        var tasks = List.of(new TaskDescriptor("_harness", "", "", null));
        Files.writeString(store.harnessPath(), "harness notes");

        assertNotEquals(store.harnessPath(), store.checkPath("_harness"));
        assertNotEquals(store.harnessPath(), store.checkPath("harness"));
        assertFalse(store.hasAllChecks(tasks));

        store.discardChecks();
        assertFalse(Files.exists(store.harnessPath()));
    }

    @Test
    @DisplayName("identities never escape their directory")
    void identitiesStayInside() {
        assertEquals(store.plansDir(), store.planPath("../../etc/passwd").getParent());
        assertEquals(store.checksDir(), store.checkPath("..").getParent());
        assertNotEquals(store.planPath("a/b"), store.planPath("a_b"));
    }

    @Test
    @DisplayName("plans are read back and discarded")
    void plans() throws Exception {
        var tasks = List.of(new TaskDescriptor("A", "", "", null), new TaskDescriptor("B/C", "", "", null));
        Files.writeString(store.planPath("A"), "plan A");
        assertFalse(store.hasAllPlans(tasks));

        Files.writeString(store.planPath("B/C"), "plan BC");
        assertTrue(store.hasAllPlans(tasks));
        assertEquals("plan BC", store.readPlan("B/C").orElseThrow());

        store.discardPlans();
        assertTrue(store.readPlan("A").isEmpty());
        assertFalse(store.hasAllPlans(tasks));
    }

    @Test
    @DisplayName("blank artifacts count as missing")
    void blankIsMissing() throws Exception {
        Files.writeString(store.planPath("A"), "   \n");
        assertTrue(store.readPlan("A").isEmpty());
    }

    @Test
    @DisplayName("guidance before an iteration is returned oldest first")
    void guidanceBefore() {
        store.writeGuidance(1, "first");
        store.writeGuidance(3, "third");

        assertEquals(List.of("first"), store.guidanceBefore(3));
        assertEquals(List.of("first", "third"), store.guidanceBefore(4));
        assertTrue(store.guidanceBefore(1).isEmpty());

        store.discardGuidance(3);
        assertTrue(store.readGuidance(3).isEmpty());
    }

    @Test
    @DisplayName("checkpoint survives a write and read")
    void checkpoint() {
        var task = new TaskDescriptor("PathViolations/A", "a.cs", "PathViolations", "A_Test");
        var apply = new JobResult(0, JobOutcome.SUCCEEDED, Duration.ofSeconds(4), "ok", "apply-work:A#1",
                "/logs/a.log", 0, task);
        var validation = new ValidationResult(2, 1, 1, List.of(new ValidationResult.FailedItem("A_Test", "still failing")));
        var context = PhaseContext.initial(2).withPlans(Map.of("PathViolations/A", "plan"))
                .withGuidance("look at A").withLastValidation(validation);
        var checkpoint = new LoopCheckpoint("MEND-2026-0007", LoopStatus.WORKING, LoopPhase.ANALYZE_FAILURES, 2, 5,
                context, List.of(), List.of(new IterationState(1, List.of(new TaskWork(task, 0, apply, apply)), validation)),
                List.of("no check for B"), Instant.parse("2026-03-01T10:00:00Z"));

        store.writeCheckpoint(checkpoint);
        LoopCheckpoint read = store.readCheckpoint().orElseThrow();

        assertEquals(checkpoint, read);
        assertFalse(Files.exists(root.resolve("checkpoint.json.tmp")));

        store.discardCheckpoint();
        assertTrue(store.readCheckpoint().isEmpty());
    }

    @Test
    @DisplayName("run sequence persists across store instances")
    void runSequence() throws Exception {
        assertEquals(1, store.nextRunSequence());
        assertEquals(2, store.nextRunSequence());
        assertEquals(3, new ArtifactStore(root).nextRunSequence());

        Files.writeString(store.runSequencePath(), "garbage");
        assertEquals(1, store.nextRunSequence());
    }

    @Test
    @DisplayName("unreadable checkpoint is an ArtifactStoreException")
    void corruptCheckpoint() throws Exception {
        Files.writeString(store.checkpointPath(), "{broken");
        assertThrows(ArtifactStoreException.class, () -> store.readCheckpoint());
    }
}
