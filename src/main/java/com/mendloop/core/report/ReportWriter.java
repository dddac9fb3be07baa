package com.mendloop.core.report;

import com.mendloop.core.analysis.RegressionDetector;
import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.artifacts.ArtifactStoreException;
import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Composes the {@link RunReport} from a loop snapshot and writes it to {@code run-report.json}.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ArtifactStore store;
    private final RegressionDetector regressionDetector;

    public ReportWriter(ArtifactStore store, RegressionDetector regressionDetector) {
        this.store = store;
        this.regressionDetector = regressionDetector;
    }

    public Path write(RunReport report) {
        Path path = store.writeReport(report);
        log.info("Run {} report written to {} ({})", report.runId(), path, report.status());
        return path;
    }

    /**
     * The report of the last finished run, if one was written.
     */
    public Optional<RunReport> read() {
        Path path = store.reportPath();
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(store.objectMapper().readValue(path.toFile(), RunReport.class));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read run report " + path, e);
        }
    }

    public RunReport compose(LoopCheckpoint snapshot, List<TaskDescriptor> tasks, LoopStatus status, String error) {
        List<IterationState> history = snapshot.history();
        IterationState last = history.isEmpty() ? null : history.get(history.size() - 1);
        ValidationResult validation = last != null ? last.validation() : null;

        List<TaskWork> work = !snapshot.currentWork().isEmpty() || last == null
                ? snapshot.currentWork()
                : last.work();

        return new RunReport(
                snapshot.runId(),
                status,
                snapshot.iteration(),
                snapshot.maxIterations(),
                validation,
                taskOutcomes(tasks, work, validation),
                summarize(history),
                regressionDetector.regressions(history),
                regressionDetector.oscillating(history),
                snapshot.setupWarnings(),
                error,
                Instant.now());
    }

    static List<RunReport.TaskOutcome> taskOutcomes(List<TaskDescriptor> tasks, List<TaskWork> work,
                                                    ValidationResult validation) {
        Map<String, TaskWork> byTask = new HashMap<>();
        for (TaskWork w : work) {
            byTask.put(w.task().identity(), w);
        }
        var outcomes = new ArrayList<RunReport.TaskOutcome>(tasks.size());
        for (TaskDescriptor task : tasks) {
            TaskWork w = byTask.get(task.identity());
            outcomes.add(new RunReport.TaskOutcome(
                    task.identity(),
                    task.category(),
                    task.sourceLocation(),
                    w != null && w.apply() != null ? w.apply().outcome() : null,
                    w != null && w.verify() != null ? w.verify().outcome() : null,
                    w != null && w.verify() != null ? w.verify().logPath() : null,
                    validation != null ? validation.failuresFor(task) : List.of()));
        }
        return outcomes;
    }

    static List<RunReport.IterationSummary> summarize(List<IterationState> history) {
        var summaries = new ArrayList<RunReport.IterationSummary>(history.size());
        for (IterationState state : history) {
            int succeeded = (int) state.work().stream().filter(TaskWork::succeeded).count();
            ValidationResult v = state.validation();
            summaries.add(new RunReport.IterationSummary(
                    state.iteration(),
                    v != null ? v.total() : 0,
                    v != null ? v.passed() : 0,
                    v != null ? v.failed() : 0,
                    succeeded,
                    state.work().size() - succeeded));
        }
        return summaries;
    }
}
