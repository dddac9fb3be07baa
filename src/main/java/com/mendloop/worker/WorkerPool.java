package com.mendloop.worker;

import com.mendloop.core.model.JobOutcome;
import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.JobSpec;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded-concurrency scheduler mapping a queue of tasks onto at most {@code workers}
 * concurrently running worker processes.
 *
 * <p>A single controlling thread fills free slots, scans running jobs for exit or an
 * expired deadline, and sleeps for the poll interval when nothing finished. Results are
 * returned in original queue order regardless of completion order, and every queued task
 * yields exactly one result per stage: failures to build or launch a job and jobs killed
 * at their deadline become synthetic results, never exceptions.
 *
 * <p>{@link #abort()} may be called from any thread. It kills every running process and
 * records the remaining work as {@link JobOutcome#CANCELLED}.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerLauncher launcher;
    private final int workers;
    private final Duration pollInterval;
    private final Duration defaultTimeout;
    private final Clock clock;

    /** Handles visible to {@link #abort()}; the controlling thread owns the scheduling state. */
    private final Set<JobHandle> live = ConcurrentHashMap.newKeySet();
    private volatile boolean aborted;
    private int peakRunning;

    public WorkerPool(WorkerLauncher launcher, int workers, Duration pollInterval, Duration defaultTimeout) {
        this(launcher, workers, pollInterval, defaultTimeout, Clock.systemUTC());
    }

    public WorkerPool(WorkerLauncher launcher, int workers, Duration pollInterval,
                      Duration defaultTimeout, Clock clock) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be >= 1, was " + workers);
        }
        if (pollInterval == null || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be >= 0, was " + pollInterval);
        }
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.workers = workers;
        this.pollInterval = pollInterval;
        this.defaultTimeout = positiveOrNull(defaultTimeout);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private record WorkItem(int queueIndex, TaskDescriptor task, int stage) {}

    public List<JobResult> run(List<TaskDescriptor> queue, PhaseContext context, JobSpecBuilder builder) {
        return run(queue, context, builder, JobListener.NONE);
    }

    /**
     * Runs one job per queued task.
     *
     * @return exactly {@code queue.size()} results, {@code results.get(i).queueIndex() == i}
     */
    public List<JobResult> run(List<TaskDescriptor> queue, PhaseContext context,
                               JobSpecBuilder builder, JobListener listener) {
        return runPipeline(queue, context, List.of(new PipelineStage("job", builder)), listener)
                .stream()
                .map(r -> r.stage(0))
                .toList();
    }

    /**
     * Runs every stage for every queued task. A task's next stage is launched as soon as its
     * previous stage finishes and a slot is free, ahead of tasks that have not started yet;
     * tasks never wait for each other.
     *
     * @return one entry per queued task in queue order, each with one result per stage
     */
    public List<TaskPipelineResult> runPipeline(List<TaskDescriptor> queue, PhaseContext context,
                                                List<PipelineStage> stages, JobListener listener) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("At least one pipeline stage is required");
        }
        JobListener callbacks = listener != null ? listener : JobListener.NONE;
        int taskCount = queue.size();
        var slots = new JobResult[taskCount][stages.size()];
        if (taskCount == 0) {
            return List.of();
        }

        Deque<WorkItem> pending = new ArrayDeque<>();
        for (int i = 0; i < taskCount; i++) {
            pending.addLast(new WorkItem(i, queue.get(i), 0));
        }
        List<JobHandle> running = new ArrayList<>();

        log.info("Scheduling {} task(s) x {} stage(s) on {} worker(s)", taskCount, stages.size(), workers);

        while (!pending.isEmpty() || !running.isEmpty()) {
            if (aborted) {
                cancelRunning(running, stages, slots, callbacks);
                break;
            }

            // (a) fill free slots
            while (running.size() < workers && !pending.isEmpty()) {
                WorkItem item = pending.pollFirst();
                JobHandle handle = launch(item, context, stages, slots, pending, callbacks);
                if (handle != null) {
                    running.add(handle);
                    live.add(handle);
                    peakRunning = Math.max(peakRunning, running.size());
                    callbacks.jobStarted(handle);
                }
            }

            // (b) collect finished or expired jobs
            boolean progressed = false;
            Instant now = clock.instant();
            for (Iterator<JobHandle> it = running.iterator(); it.hasNext(); ) {
                JobHandle handle = it.next();
                JobResult result;
                if (!handle.process().isAlive()) {
                    result = collect(handle, now);
                } else if (handle.expired(now)) {
                    result = kill(handle, now);
                } else {
                    continue;
                }
                it.remove();
                live.remove(handle);
                record(result, handle.queueIndex(), handle.task(), handle.stage(), stages, slots, pending, callbacks);
                progressed = true;
            }

            // (c) nothing finished: wait a bounded interval before re-scanning
            if (!progressed && !running.isEmpty()) {
                pause();
            }
        }

        fillCancelled(queue, stages, slots, callbacks);

        var results = new ArrayList<TaskPipelineResult>(taskCount);
        for (int i = 0; i < taskCount; i++) {
            results.add(new TaskPipelineResult(i, queue.get(i), Arrays.asList(slots[i])));
        }
        return List.copyOf(results);
    }

    /**
     * Kills every running worker and makes the pool return as soon as the controlling
     * thread notices. Sticky: a pool that was aborted cancels all later work.
     */
    public void abort() {
        if (!aborted && !live.isEmpty()) {
            log.warn("Abort requested, terminating {} running worker(s)", live.size());
        }
        aborted = true;
        for (JobHandle handle : live) {
            handle.process().destroy();
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    public int workers() {
        return workers;
    }

    /** Highest number of simultaneously running jobs observed by this pool. */
    public int peakRunning() {
        return peakRunning;
    }

    private JobHandle launch(WorkItem item, PhaseContext context, List<PipelineStage> stages,
                             JobResult[][] slots, Deque<WorkItem> pending, JobListener callbacks) {
        PipelineStage stage = stages.get(item.stage());
        TaskDescriptor task = item.task();

        JobSpec spec;
        try {
            spec = stage.builder().build(task, context);
            Objects.requireNonNull(spec, "builder returned null");
        } catch (RuntimeException e) {
            log.error("Could not build {} job for task {}: {}", stage.name(), task.identity(), e.getMessage());
            var result = JobResult.specFailed(stage.name() + ":" + task.identity(),
                    "Job spec builder failed: " + e.getMessage(), item.queueIndex(), task);
            record(result, item.queueIndex(), task, item.stage(), stages, slots, pending, callbacks);
            return null;
        }

        WorkerProcess process;
        try {
            process = launcher.launch(spec);
        } catch (Exception e) {
            log.error("Could not launch {}: {}", spec.label(), e.getMessage());
            var result = JobResult.launchFailed(spec, "Launch failed: " + e.getMessage(), item.queueIndex(), task);
            record(result, item.queueIndex(), task, item.stage(), stages, slots, pending, callbacks);
            return null;
        }

        Instant startedAt = clock.instant();
        Duration timeout = spec.timeout() != null ? positiveOrNull(spec.timeout()) : defaultTimeout;
        Instant deadline = timeout != null ? startedAt.plus(timeout) : null;
        log.info("Launched {} (queue #{})", spec.label(), item.queueIndex());
        return new JobHandle(spec, process, startedAt, deadline, item.queueIndex(), task, item.stage());
    }

    private JobResult collect(JobHandle handle, Instant now) {
        WorkerProcess process = handle.process();
        try {
            int exitCode = process.exitCode();
            Duration duration = Duration.between(handle.startedAt(), now);
            JobOutcome outcome = exitCode == 0 ? JobOutcome.SUCCEEDED : JobOutcome.FAILED;
            log.info("{} exited with code {} in {}ms", handle.spec().label(), exitCode, duration.toMillis());
            return new JobResult(exitCode, outcome, duration, process.output(),
                    handle.spec().label(), handle.spec().logPath(), handle.queueIndex(), handle.task());
        } finally {
            process.release();
        }
    }

    private JobResult kill(JobHandle handle, Instant now) {
        WorkerProcess process = handle.process();
        try {
            process.destroy();
            Duration duration = Duration.between(handle.startedAt(), now);
            log.warn("{} exceeded its deadline after {}ms, terminated", handle.spec().label(), duration.toMillis());
            return new JobResult(JobResult.TIMEOUT_EXIT_CODE, JobOutcome.TIMED_OUT, duration,
                    process.output(), handle.spec().label(), handle.spec().logPath(),
                    handle.queueIndex(), handle.task());
        } finally {
            process.release();
        }
    }

    private void cancelRunning(List<JobHandle> running, List<PipelineStage> stages,
                               JobResult[][] slots, JobListener callbacks) {
        Instant now = clock.instant();
        for (JobHandle handle : running) {
            WorkerProcess process = handle.process();
            try {
                process.destroy();
            } finally {
                process.release();
            }
            live.remove(handle);
            var result = JobResult.cancelled(handle.spec().label(), handle.spec().logPath(),
                    Duration.between(handle.startedAt(), now), handle.queueIndex(), handle.task());
            slots[handle.queueIndex()][handle.stage()] = result;
            callbacks.jobCompleted(result, stages.get(handle.stage()).name());
        }
        running.clear();
    }

    private void fillCancelled(List<TaskDescriptor> queue, List<PipelineStage> stages,
                               JobResult[][] slots, JobListener callbacks) {
        for (int i = 0; i < slots.length; i++) {
            for (int s = 0; s < stages.size(); s++) {
                if (slots[i][s] == null) {
                    var result = JobResult.cancelled(stages.get(s).name() + ":" + queue.get(i).identity(),
                            "", Duration.ZERO, i, queue.get(i));
                    slots[i][s] = result;
                    callbacks.jobCompleted(result, stages.get(s).name());
                }
            }
        }
    }

    private static void record(JobResult result, int queueIndex, TaskDescriptor task, int stage,
                               List<PipelineStage> stages, JobResult[][] slots,
                               Deque<WorkItem> pending, JobListener callbacks) {
        slots[queueIndex][stage] = result;
        callbacks.jobCompleted(result, stages.get(stage).name());
        if (stage + 1 < stages.size()) {
            pending.addFirst(new WorkItem(queueIndex, task, stage + 1));
        }
    }

    private void pause() {
        if (pollInterval.isZero()) {
            Thread.onSpinWait();
            return;
        }
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
        }
    }

    private static Duration positiveOrNull(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative() ? duration : null;
    }
}
