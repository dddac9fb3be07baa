package com.mendloop.core.phases;

import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.state.LoopState;
import com.mendloop.worker.PipelineStage;
import com.mendloop.worker.TaskPipelineResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The WORKING state: apply-work then verify-work over every task, every iteration.
 *
 * <p>Both phases run as one two-stage pipeline on the pool, so a task's verify job starts as
 * soon as its own apply job has finished while other tasks are still being applied. Verify
 * runs even when apply failed; the worker decides whether there is anything to correct.
 */
@Component
public class WorkPhase {

    private final PhaseRunner runner;
    private final JobSpecFactory specs;

    public WorkPhase(PhaseRunner runner, JobSpecFactory specs) {
        this.runner = runner;
        this.specs = specs;
    }

    public Map<String, Object> apply(LoopState state) {
        int iteration = state.iteration();
        String runId = state.runId();
        var resume = state.resumePoint();

        if (resume.skips(LoopPhase.VERIFY_WORK, iteration)) {
            runner.phaseSkipped(runId, LoopPhase.APPLY_WORK, iteration, "work already recorded for this iteration");
            return new HashMap<>();
        }

        List<TaskDescriptor> tasks = state.tasks();
        PhaseContext context = state.context().withIteration(iteration);
        boolean verifyOnly = resume.skips(LoopPhase.APPLY_WORK, iteration);

        var stages = new ArrayList<PipelineStage>();
        if (!verifyOnly) {
            stages.add(new PipelineStage(LoopPhase.APPLY_WORK.slug(), (task, ctx) ->
                    specs.create(LoopPhase.APPLY_WORK, task, ctx.iteration(), InstructionBuilder.applyWork(task, ctx))));
        }
        stages.add(new PipelineStage(LoopPhase.VERIFY_WORK.slug(), (task, ctx) ->
                specs.create(LoopPhase.VERIFY_WORK, task, ctx.iteration(), InstructionBuilder.verifyWork(task, ctx))));

        runner.phaseStarted(runId, verifyOnly ? LoopPhase.VERIFY_WORK : LoopPhase.APPLY_WORK, iteration);
        List<TaskPipelineResult> results = runner.runPipeline(runId, iteration, tasks, context, stages);

        Map<String, JobResult> previousApply = previousApply(state, verifyOnly);
        var work = new ArrayList<TaskWork>(results.size());
        for (TaskPipelineResult result : results) {
            JobResult apply = verifyOnly ? previousApply.get(result.task().identity()) : result.stage(0);
            JobResult verify = result.stage(verifyOnly ? 0 : 1);
            work.add(new TaskWork(result.task(), result.queueIndex(), apply, verify));
        }

        long succeeded = work.stream().filter(TaskWork::succeeded).count();
        runner.publish("work.completed", runId,
                Map.of("iteration", iteration, "tasks", work.size(), "succeeded", succeeded));

        var updates = new HashMap<String, Object>();
        updates.put("status", LoopStatus.EVALUATING.name());
        updates.put("context", context);
        updates.put("currentWork", List.copyOf(work));
        runner.checkpoint(state, updates, LoopPhase.VERIFY_WORK);
        return updates;
    }

    /**
     * Apply results recorded before a resume at verify-work, keyed by task identity.
     */
    private static Map<String, JobResult> previousApply(LoopState state, boolean verifyOnly) {
        var byTask = new HashMap<String, JobResult>();
        if (verifyOnly) {
            for (TaskWork w : state.currentWork()) {
                if (w.apply() != null) {
                    byTask.put(w.task().identity(), w.apply());
                }
            }
        }
        return byTask;
    }
}
