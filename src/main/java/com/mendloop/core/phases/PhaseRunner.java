package com.mendloop.core.phases;

import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.events.EventBus;
import com.mendloop.core.logging.MdcContext;
import com.mendloop.core.metrics.MendloopMetrics;
import com.mendloop.core.model.JobOutcome;
import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.state.LoopState;
import com.mendloop.worker.JobHandle;
import com.mendloop.worker.JobListener;
import com.mendloop.worker.JobSpecBuilder;
import com.mendloop.worker.PipelineStage;
import com.mendloop.worker.TaskPipelineResult;
import com.mendloop.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a phase's jobs on the {@link WorkerPool}, wiring every job into the event bus,
 * metrics and MDC, and writes the checkpoint once a phase completes.
 *
 * <p>Judging outcomes is left to the phases; this class only observes. The one exception
 * is an aborted pool, which surfaces as {@link RunAbortedException}.
 */
@Component
public class PhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunner.class);

    private final WorkerPool pool;
    private final ArtifactStore store;
    private final EventBus eventBus;
    private final MendloopMetrics metrics;

    public PhaseRunner(WorkerPool pool, ArtifactStore store, EventBus eventBus, MendloopMetrics metrics) {
        this.pool = pool;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public List<JobResult> run(String runId, LoopPhase phase, int iteration, List<TaskDescriptor> queue,
                               PhaseContext context, JobSpecBuilder builder) {
        return runPipeline(runId, iteration, queue, context, List.of(new PipelineStage(phase.slug(), builder)))
                .stream()
                .map(r -> r.stage(0))
                .toList();
    }

    public List<TaskPipelineResult> runPipeline(String runId, int iteration, List<TaskDescriptor> queue,
                                                PhaseContext context, List<PipelineStage> stages) {
        checkNotAborted();
        long start = System.currentTimeMillis();
        var listener = new PhaseListener(runId);
        List<TaskPipelineResult> results = pool.runPipeline(queue, context, stages, listener);
        checkNotAborted();

        long elapsed = System.currentTimeMillis() - start;
        for (PipelineStage stage : stages) {
            metrics.recordPhaseDuration(stage.name(), elapsed);
        }
        long failed = results.stream()
                .flatMap(r -> r.stageResults().stream())
                .filter(r -> !r.succeeded())
                .count();
        log.info("{} finished for {} task(s) in iteration {}: {} job(s) failed ({}ms)",
                stageNames(stages), queue.size(), iteration, failed, elapsed);
        return results;
    }

    public void phaseStarted(String runId, LoopPhase phase, int iteration) {
        MdcContext.setPhase(runId, phase.slug(), iteration);
        log.info("Phase {} starting (iteration {})", phase.slug(), iteration);
        eventBus.publish("phase.started", runId, null,
                Map.of("phase", phase.slug(), "iteration", iteration));
    }

    public void phaseSkipped(String runId, LoopPhase phase, int iteration, String reason) {
        log.info("Phase {} skipped (iteration {}): {}", phase.slug(), iteration, reason);
        eventBus.publish("phase.skipped", runId, null,
                Map.of("phase", phase.slug(), "iteration", iteration, "reason", reason));
    }

    /**
     * Persists the state a node is about to return, so a restart resumes after {@code completed}.
     */
    public LoopState checkpoint(LoopState state, Map<String, Object> updates, LoopPhase completed) {
        LoopState after = state.withUpdates(updates);
        store.writeCheckpoint(after.toCheckpoint(completed));
        return after;
    }

    public void publish(String eventType, String runId, Map<String, Object> payload) {
        eventBus.publish(eventType, runId, null, payload);
    }

    public void checkNotAborted() {
        if (pool.isAborted() || Thread.currentThread().isInterrupted()) {
            throw new RunAbortedException("Run aborted by operator");
        }
    }

    public MendloopMetrics metrics() {
        return metrics;
    }

    private static String stageNames(List<PipelineStage> stages) {
        return String.join("+", stages.stream().map(PipelineStage::name).toList());
    }

    /**
     * Bridges pool callbacks (on the controlling thread) to events, metrics and MDC.
     */
    private final class PhaseListener implements JobListener {

        private final String runId;

        PhaseListener(String runId) {
            this.runId = runId;
        }

        @Override
        public void jobStarted(JobHandle handle) {
            eventBus.publish("job.started", runId, handle.task().identity(),
                    Map.of("label", handle.spec().label()));
        }

        @Override
        public void jobCompleted(JobResult result, String stage) {
            String taskId = result.task() != null ? result.task().identity() : "";
            MdcContext.setTask(taskId);
            try {
                if (result.outcome() == JobOutcome.TIMED_OUT) {
                    metrics.recordTimeout(stage);
                }
                if (result.outcome() != JobOutcome.SUCCEEDED) {
                    log.warn("{} ended {} (exit code {}), log: {}",
                            result.label(), result.outcome(), result.exitCode(), result.logPath());
                }
                metrics.recordJob(stage, result.outcome(), result.duration());

                var payload = new HashMap<String, Object>();
                payload.put("phase", stage);
                payload.put("label", result.label());
                payload.put("outcome", result.outcome().name());
                payload.put("exitCode", result.exitCode());
                payload.put("durationMs", result.duration().toMillis());
                eventBus.publish("job.completed", runId, taskId, payload);
            } finally {
                MdcContext.clearTask();
            }
        }
    }
}
