package com.mendloop.core.report;

import com.mendloop.core.analysis.RegressionDetector;
import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.artifacts.ArtifactStoreException;
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
import com.mendloop.core.model.ValidationResult.FailedItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private ArtifactStore store;
    private ReportWriter writer;

    private final TaskDescriptor expander = new TaskDescriptor("PathViolations/UsesPathGetFullPath",
            "src/Build/Evaluation/Expander.cs", "PathViolations", "Expander_UsesPathGetFullPath");
    private final TaskDescriptor copy = new TaskDescriptor("PathViolations/UsesFileExists",
            "src/Tasks/Copy.cs", "PathViolations", null);

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(tempDir.resolve(".mendloop"));
        writer = new ReportWriter(store, new RegressionDetector());
    }

    private static JobResult job(TaskDescriptor task, int exitCode, String label) {
        return new JobResult(exitCode, exitCode == 0 ? JobOutcome.SUCCEEDED : JobOutcome.FAILED,
                Duration.ofSeconds(2), "", label, "logs/" + label + ".log", 0, task);
    }

    private LoopCheckpoint snapshot(List<TaskWork> currentWork, List<IterationState> history) {
        return new LoopCheckpoint("MEND-2026-0007", LoopStatus.DONE_CEILING, LoopPhase.RUN_VALIDATION, 2, 2,
                PhaseContext.initial(2), currentWork, history, List.of("No check produced for X"), Instant.now());
    }

    @Test
    @DisplayName("compose attributes failures and job outcomes to tasks")
    void composeAttributesFailures() {
        var work = List.of(
                new TaskWork(expander, 0, job(expander, 0, "apply-a"), job(expander, 0, "verify-a")),
                new TaskWork(copy, 1, job(copy, 1, "apply-b"), job(copy, 0, "verify-b")));
        var validation = new ValidationResult(3, 2, 1,
                List.of(new FailedItem("Expander_UsesPathGetFullPath", "still calls GetFullPath")));

        RunReport report = writer.compose(snapshot(List.of(), List.of(new IterationState(1, work, validation))),
                List.of(expander, copy), LoopStatus.DONE_CEILING, null);

        assertEquals("MEND-2026-0007", report.runId());
        assertEquals(validation, report.validation());
        assertEquals(1, report.tasks().get(0).failures().size());
        assertTrue(report.tasks().get(1).failures().isEmpty());
        assertEquals(JobOutcome.FAILED, report.tasks().get(1).apply());
        assertEquals("logs/verify-a.log", report.tasks().get(0).verifyLog());
        assertEquals(1, report.history().get(0).tasksSucceeded());
        assertEquals(List.of("No check produced for X"), report.setupWarnings());
    }

    @Test
    @DisplayName("a task with no recorded work has empty outcomes")
    void taskWithoutWork() {
        RunReport report = writer.compose(snapshot(List.of(), List.of()), List.of(expander),
                LoopStatus.ABORTED, "boom");

        assertNull(report.validation());
        assertNull(report.tasks().get(0).apply());
        assertNull(report.tasks().get(0).verify());
        assertEquals("boom", report.error());
    }

    @Test
    @DisplayName("regressions across iterations are reported")
    void reportsRegressions() {
        var first = new ValidationResult(2, 1, 1, List.of(new FailedItem("a", "x")));
        var second = new ValidationResult(2, 1, 1, List.of(new FailedItem("b", "y")));

        RunReport report = writer.compose(snapshot(List.of(), List.of(
                new IterationState(1, List.of(), first),
                new IterationState(2, List.of(), second))), List.of(), LoopStatus.DONE_CEILING, null);

        assertEquals(1, report.regressions().size());
        assertEquals("b", report.regressions().get(0).name());
        assertEquals(2, report.regressions().get(0).iteration());
    }

    @Test
    @DisplayName("write then read returns the same report")
    void writeAndRead() {
        RunReport report = writer.compose(snapshot(List.of(), List.of()), List.of(expander), LoopStatus.DONE_PASS, null);

        Path path = writer.write(report);

        assertEquals(store.reportPath(), path);
        RunReport read = writer.read().orElseThrow();
        assertEquals(report.runId(), read.runId());
        assertEquals(LoopStatus.DONE_PASS, read.status());
        assertEquals(1, read.tasks().size());
    }

    @Test
    @DisplayName("read is empty when no report exists and fails on a corrupt one")
    void readMissingAndCorrupt() throws Exception {
        assertTrue(writer.read().isEmpty());

        Files.createDirectories(store.root());
        Files.writeString(store.reportPath(), "{not json");

        assertThrows(ArtifactStoreException.class, () -> writer.read());
    }
}
