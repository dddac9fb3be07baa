package com.mendloop.core.engine;

import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.events.EventBus;
import com.mendloop.core.graph.ConvergenceGraph;
import com.mendloop.core.logging.MdcContext;
import com.mendloop.core.manifest.ManifestLoader;
import com.mendloop.core.metrics.MendloopMetrics;
import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.ResumePoint;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.report.ReportWriter;
import com.mendloop.core.report.RunReport;
import com.mendloop.core.state.LoopState;
import com.mendloop.core.validation.ValidationHarness;
import com.mendloop.worker.WorkerLauncher;
import com.mendloop.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs the convergence loop by bridging the CLI to the LangGraph4j graph.
 * <p>
 * Loads the manifest, checks the validation harness is present, builds the initial state
 * (fresh, from the checkpoint, or rebuilt from artifacts for an explicit resume point) and
 * invokes the compiled graph. Any failure on the way ends in an ABORTED report written from
 * the last checkpoint, so every run produces exactly one report.
 */
@Service
public class ConvergenceEngine {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceEngine.class);

    private final ConvergenceGraph graph;
    private final ManifestLoader manifestLoader;
    private final ValidationHarness harness;
    private final ArtifactStore store;
    private final ReportWriter reportWriter;
    private final WorkerPool pool;
    private final WorkerLauncher launcher;
    private final EventBus eventBus;
    private final MendloopMetrics metrics;
    private final LoopProperties properties;

    public ConvergenceEngine(ConvergenceGraph graph, ManifestLoader manifestLoader, ValidationHarness harness,
                             ArtifactStore store, ReportWriter reportWriter, WorkerPool pool,
                             WorkerLauncher launcher, EventBus eventBus, MendloopMetrics metrics,
                             LoopProperties properties) {
        this.graph = graph;
        this.manifestLoader = manifestLoader;
        this.harness = harness;
        this.store = store;
        this.reportWriter = reportWriter;
        this.pool = pool;
        this.launcher = launcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public RunOutcome run(RunRequest request) {
        String runId = generateRunId();
        List<TaskDescriptor> tasks = List.of();
        LoopCheckpoint checkpoint = null;
        LoopCheckpoint baseline = null;
        int maxIterations = request.maxIterations() != null ? request.maxIterations() : properties.getMaxIterations();
        MdcContext.setRun(runId);
        try {
            if (request.resume()) {
                checkpoint = store.readCheckpoint().orElseThrow(() -> new IllegalStateException(
                        "No checkpoint to resume from at " + store.checkpointPath()));
                runId = checkpoint.runId();
                baseline = checkpoint;
                MdcContext.setRun(runId);
                if (request.maxIterations() == null) {
                    maxIterations = checkpoint.maxIterations();
                }
            }
            if (maxIterations < 1) {
                throw new IllegalArgumentException("max-iterations must be >= 1, was " + maxIterations);
            }

            tasks = manifestLoader.load(request.manifest());
            harness.verifyAvailable();
            store.prepare();
            if (!launcher.isAvailable()) {
                log.warn("Worker executable not found on PATH; jobs will be recorded as launch failures");
            }

            ResumePoint resumePoint = resumePoint(request, checkpoint);
            if (resumePoint.iteration() > maxIterations) {
                throw new IllegalArgumentException("Resume iteration " + resumePoint.iteration()
                        + " exceeds max-iterations " + maxIterations);
            }

            log.info("Starting run {} over {} task(s), max {} iteration(s), entering at {} (iteration {})",
                    runId, tasks.size(), maxIterations, resumePoint.phase().slug(), resumePoint.iteration());
            eventBus.publish("run.started", runId, null, Map.of(
                    "tasks", tasks.size(),
                    "maxIterations", maxIterations,
                    "phase", resumePoint.phase().slug(),
                    "iteration", resumePoint.iteration()));

            if (checkpoint != null && checkpoint.completedPhase() == LoopPhase.FINALIZE && request.fromPhase() == null) {
                log.info("Run {} already finished with {}", runId, checkpoint.status());
                return outcomeOf(checkpoint, store.reportPath().toString());
            }

            Map<String, Object> initial = initialState(runId, tasks, maxIterations, resumePoint, checkpoint);
            if (checkpoint == null) {
                baseline = new LoopState(initial).toCheckpoint(resumePoint.phase());
                store.discardCheckpoint();
            }
            if (resumePoint.phase() == LoopPhase.FINALIZE) {
                return finalizeDirectly(new LoopState(initial), tasks);
            }

            String activeRunId = runId;
            LoopState state = graph.invoke(initial, activeRunId, maxIterations)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + activeRunId));

            log.info("Run {} finished: {} after {} iteration(s)", activeRunId, state.status(), state.iteration());
            return new RunOutcome(activeRunId, state.status(), state.iteration(),
                    state.latestValidation().orElse(null), state.reportPath(), null);
        } catch (RuntimeException e) {
            return abort(runId, tasks, maxIterations, baseline, e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Kills running workers; the run in progress ends with an ABORTED report.
     */
    public void abort() {
        pool.abort();
    }

    /**
     * Generates a run ID in the format MEND-YYYY-NNNN. The sequence lives in the artifact
     * directory, so it keeps counting across invocations.
     */
    public String generateRunId() {
        int count = store.nextRunSequence();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("MEND-%d-%04d", year, count);
    }

    static ResumePoint resumePoint(RunRequest request, LoopCheckpoint checkpoint) {
        if (request.fromPhase() != null) {
            int iteration = request.iteration() != null ? request.iteration()
                    : checkpoint != null ? checkpoint.iteration() : 1;
            return new ResumePoint(request.fromPhase(), iteration);
        }
        if (checkpoint != null) {
            return checkpoint.nextResumePoint();
        }
        if (request.iteration() != null) {
            return new ResumePoint(LoopPhase.APPLY_WORK, request.iteration());
        }
        return ResumePoint.fresh();
    }

    private Map<String, Object> initialState(String runId, List<TaskDescriptor> tasks, int maxIterations,
                                             ResumePoint resumePoint, LoopCheckpoint checkpoint) {
        if (checkpoint != null) {
            List<IterationState> history = historyBefore(checkpoint.history(), resumePoint);
            List<TaskWork> work = resumePoint.iteration() == checkpoint.iteration()
                    ? checkpoint.currentWork() : List.of();
            LoopStatus status = checkpoint.status() == LoopStatus.ABORTED ? LoopStatus.WORKING : checkpoint.status();
            return LoopState.initialData(runId, tasks, maxIterations, resumePoint, status,
                    checkpoint.context(), work, history, checkpoint.setupWarnings());
        }
        LoopStatus status = resumePoint.phase().isSetup() ? LoopStatus.SETUP : LoopStatus.WORKING;
        return LoopState.initialData(runId, tasks, maxIterations, resumePoint, status,
                rebuildContext(tasks, resumePoint), List.of(), List.of(), List.of());
    }

    /**
     * Context for an explicit resume point without a checkpoint: every durable artifact on
     * disk is reloaded, guidance up to the iteration before the resume point.
     */
    PhaseContext rebuildContext(List<TaskDescriptor> tasks, ResumePoint resumePoint) {
        if (resumePoint.equals(ResumePoint.fresh())) {
            return PhaseContext.initial(1);
        }
        var plans = new HashMap<String, String>();
        var checks = new HashMap<String, String>();
        for (TaskDescriptor task : tasks) {
            store.readPlan(task.identity()).ifPresent(plan -> plans.put(task.identity(), plan));
            if (store.hasCheck(task.identity())) {
                checks.put(task.identity(), store.checkPath(task.identity()).toString());
            }
        }
        List<String> guidance = store.guidanceBefore(resumePoint.iteration());
        return new PhaseContext(resumePoint.iteration(), plans, checks,
                guidance.isEmpty() ? "" : guidance.get(guidance.size() - 1), guidance, null);
    }

    /**
     * Drops iterations the resumed run will record again, so history never holds an iteration twice.
     */
    static List<IterationState> historyBefore(List<IterationState> history, ResumePoint resumePoint) {
        return history.stream()
                .filter(s -> s.iteration() < resumePoint.iteration()
                        || (s.iteration() == resumePoint.iteration()
                            && resumePoint.phase().ordinal() > LoopPhase.RUN_VALIDATION.ordinal()))
                .toList();
    }

    private RunOutcome finalizeDirectly(LoopState state, List<TaskDescriptor> tasks) {
        LoopStatus status = state.status() == LoopStatus.DONE_PASS ? LoopStatus.DONE_PASS : LoopStatus.DONE_CEILING;
        LoopCheckpoint snapshot = state.toCheckpoint(LoopPhase.FINALIZE);
        Path path = reportWriter.write(reportWriter.compose(snapshot, tasks, status, null));
        metrics.recordRunResult(status.name());
        store.writeCheckpoint(new LoopCheckpoint(snapshot.runId(), status, LoopPhase.FINALIZE, snapshot.iteration(),
                snapshot.maxIterations(), snapshot.context(), snapshot.currentWork(), snapshot.history(),
                snapshot.setupWarnings(), Instant.now()));
        publishFinished(snapshot.runId(), status, snapshot.iteration(), path);
        return new RunOutcome(snapshot.runId(), status, snapshot.iteration(),
                state.latestValidation().orElse(null), path.toString(), null);
    }

    /**
     * Writes the ABORTED report from the newest snapshot this run produced: its last checkpoint,
     * else the state it started from, else an empty snapshot when it never got that far.
     */
    private RunOutcome abort(String runId, List<TaskDescriptor> tasks, int maxIterations,
                             LoopCheckpoint baseline, RuntimeException e) {
        String error = describe(e);
        log.error("Run {} aborted: {}", runId, error, e);

        LoopCheckpoint snapshot = baseline == null ? null : latestCheckpoint(runId).orElse(baseline);
        if (snapshot == null) {
            snapshot = new LoopCheckpoint(runId, LoopStatus.ABORTED, LoopPhase.PROPOSE_FIX, 1,
                    Math.max(1, maxIterations), PhaseContext.initial(1), List.of(), List.of(), List.of(),
                    Instant.now());
        }

        String reportPath = null;
        try {
            RunReport report = reportWriter.compose(snapshot, tasks, LoopStatus.ABORTED, error);
            reportPath = reportWriter.write(report).toString();
        } catch (RuntimeException reportFailure) {
            log.error("Could not write the ABORTED report for run {}", runId, reportFailure);
        }
        metrics.recordRunResult(LoopStatus.ABORTED.name());
        publishFinished(runId, LoopStatus.ABORTED, snapshot.iteration(), reportPath != null ? Path.of(reportPath) : null);

        var history = snapshot.history();
        return new RunOutcome(runId, LoopStatus.ABORTED, snapshot.iteration(),
                history.isEmpty() ? null : history.get(history.size() - 1).validation(), reportPath, error);
    }

    private Optional<LoopCheckpoint> latestCheckpoint(String runId) {
        try {
            return store.readCheckpoint().filter(c -> c.runId().equals(runId));
        } catch (RuntimeException unreadable) {
            log.warn("Checkpoint unreadable while aborting: {}", unreadable.getMessage());
            return Optional.empty();
        }
    }

    private RunOutcome outcomeOf(LoopCheckpoint checkpoint, String reportPath) {
        var history = checkpoint.history();
        return new RunOutcome(checkpoint.runId(), checkpoint.status(), checkpoint.iteration(),
                history.isEmpty() ? null : history.get(history.size() - 1).validation(), reportPath, null);
    }

    private void publishFinished(String runId, LoopStatus status, int iteration, Path reportPath) {
        var payload = new HashMap<String, Object>();
        payload.put("status", status.name());
        payload.put("iterations", iteration);
        payload.put("reportPath", reportPath != null ? reportPath.toString() : "");
        eventBus.publish("run.finished", runId, null, payload);
    }

    /**
     * Message of the first meaningful cause: graph execution wraps node failures in
     * completion and plain runtime exceptions.
     */
    static String describe(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current
                && (current instanceof CompletionException
                    || current instanceof ExecutionException
                    || current.getClass() == RuntimeException.class)) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
