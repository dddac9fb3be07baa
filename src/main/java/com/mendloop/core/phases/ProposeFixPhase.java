package com.mendloop.core.phases;

import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.state.LoopState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Setup phase 1: one job per task writing {@code plans/<task>.md}.
 *
 * <p>At iteration 1 the phase is skipped when every plan already exists. When entered at a
 * later iteration the stale plans are discarded and regenerated, since the accumulated
 * guidance may change what a plan should say.
 */
@Component
public class ProposeFixPhase {

    private static final Logger log = LoggerFactory.getLogger(ProposeFixPhase.class);

    private final PhaseRunner runner;
    private final JobSpecFactory specs;

    public ProposeFixPhase(PhaseRunner runner, JobSpecFactory specs) {
        this.runner = runner;
        this.specs = specs;
    }

    public Map<String, Object> apply(LoopState state) {
        ArtifactStore store = specs.store();
        List<TaskDescriptor> tasks = state.tasks();
        int iteration = state.iteration();
        PhaseContext context = state.context();

        if (state.resumePoint().skips(LoopPhase.PROPOSE_FIX, iteration)) {
            runner.phaseSkipped(state.runId(), LoopPhase.PROPOSE_FIX, iteration, "resuming at a later phase");
            return reuse(state, tasks, context, store);
        }

        runner.phaseStarted(state.runId(), LoopPhase.PROPOSE_FIX, iteration);
        if (iteration == 1 && store.hasAllPlans(tasks)) {
            runner.phaseSkipped(state.runId(), LoopPhase.PROPOSE_FIX, iteration, "plans already exist");
            Map<String, Object> updates = reuse(state, tasks, context, store);
            runner.checkpoint(state, updates, LoopPhase.PROPOSE_FIX);
            return updates;
        }
        if (iteration > 1) {
            store.discardPlans();
        }

        List<JobResult> results = runner.run(state.runId(), LoopPhase.PROPOSE_FIX, iteration, tasks, context,
                (task, ctx) -> specs.create(LoopPhase.PROPOSE_FIX, task, ctx.iteration(),
                        InstructionBuilder.proposeFix(task, store.planPath(task.identity()).toString(), ctx)));

        var warnings = new ArrayList<String>();
        Map<String, String> plans = loadPlans(tasks, store, warnings);
        for (JobResult result : results) {
            if (!result.succeeded() && !plans.containsKey(result.task().identity())) {
                log.warn("No plan for {}: {} ended {}", result.task().identity(), result.label(), result.outcome());
            }
        }

        var updates = new HashMap<String, Object>();
        updates.put("status", LoopStatus.SETUP.name());
        updates.put("context", context.withPlans(plans));
        updates.put("setupWarnings", warnings);
        runner.checkpoint(state, updates, LoopPhase.PROPOSE_FIX);
        return updates;
    }

    private Map<String, Object> reuse(LoopState state, List<TaskDescriptor> tasks,
                                      PhaseContext context, ArtifactStore store) {
        var warnings = new ArrayList<String>();
        var updates = new HashMap<String, Object>();
        updates.put("context", context.withPlans(loadPlans(tasks, store, warnings)));
        warnings.removeAll(state.setupWarnings());
        updates.put("setupWarnings", warnings);
        return updates;
    }

    /**
     * Reads every plan present on disk; each missing plan becomes a warning.
     */
    static Map<String, String> loadPlans(List<TaskDescriptor> tasks, ArtifactStore store, List<String> warnings) {
        var plans = new HashMap<String, String>();
        for (TaskDescriptor task : tasks) {
            store.readPlan(task.identity()).ifPresentOrElse(
                    plan -> plans.put(task.identity(), plan),
                    () -> warnings.add("No plan produced for " + task.identity()));
        }
        return plans;
    }
}
