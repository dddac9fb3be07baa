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
 * Setup phase 2: one shared job establishing the check harness, then one job per task
 * writing {@code checks/<task>.md}.
 *
 * <p>A failed harness job is recorded as a setup warning and the per-task jobs still run.
 * Skip and regeneration rules match {@link ProposeFixPhase}.
 */
@Component
public class ScaffoldChecksPhase {

    private static final Logger log = LoggerFactory.getLogger(ScaffoldChecksPhase.class);

    static final String HARNESS_TASK = "check-harness";

    private final PhaseRunner runner;
    private final JobSpecFactory specs;

    public ScaffoldChecksPhase(PhaseRunner runner, JobSpecFactory specs) {
        this.runner = runner;
        this.specs = specs;
    }

    public Map<String, Object> apply(LoopState state) {
        ArtifactStore store = specs.store();
        List<TaskDescriptor> tasks = state.tasks();
        int iteration = state.iteration();
        PhaseContext context = state.context();
        String runId = state.runId();

        if (state.resumePoint().skips(LoopPhase.SCAFFOLD_CHECKS, iteration)) {
            runner.phaseSkipped(runId, LoopPhase.SCAFFOLD_CHECKS, iteration, "resuming at a later phase");
            return reuse(state, tasks, context, store);
        }

        runner.phaseStarted(runId, LoopPhase.SCAFFOLD_CHECKS, iteration);
        if (iteration == 1 && store.hasAllChecks(tasks)) {
            runner.phaseSkipped(runId, LoopPhase.SCAFFOLD_CHECKS, iteration, "checks already exist");
            Map<String, Object> updates = reuse(state, tasks, context, store);
            updates.put("status", LoopStatus.WORKING.name());
            runner.checkpoint(state, updates, LoopPhase.SCAFFOLD_CHECKS);
            return updates;
        }
        if (iteration > 1) {
            store.discardChecks();
        }

        var warnings = new ArrayList<String>();
        String harnessPath = store.harnessPath().toString();

        JobResult harness = runner.run(runId, LoopPhase.SCAFFOLD_CHECKS, iteration,
                List.of(TaskDescriptor.shared(HARNESS_TASK)), context,
                (task, ctx) -> specs.createShared(LoopPhase.SCAFFOLD_CHECKS, task, ctx.iteration(),
                        InstructionBuilder.scaffoldHarness(tasks, harnessPath))).get(0);
        if (!harness.succeeded()) {
            String warning = "Check harness setup " + harness.outcome() + " (exit code " + harness.exitCode()
                    + "), see " + harness.logPath();
            log.warn("{}; continuing with per-task checks", warning);
            warnings.add(warning);
        }

        runner.run(runId, LoopPhase.SCAFFOLD_CHECKS, iteration, tasks, context,
                (task, ctx) -> specs.create(LoopPhase.SCAFFOLD_CHECKS, task, ctx.iteration(),
                        InstructionBuilder.scaffoldCheck(task, store.checkPath(task.identity()).toString(),
                                harnessPath, ctx)));

        var updates = new HashMap<String, Object>();
        updates.put("status", LoopStatus.WORKING.name());
        updates.put("context", context.withChecks(loadChecks(tasks, store, warnings)));
        updates.put("setupWarnings", warnings);
        runner.checkpoint(state, updates, LoopPhase.SCAFFOLD_CHECKS);
        return updates;
    }

    private Map<String, Object> reuse(LoopState state, List<TaskDescriptor> tasks,
                                      PhaseContext context, ArtifactStore store) {
        var warnings = new ArrayList<String>();
        var updates = new HashMap<String, Object>();
        updates.put("context", context.withChecks(loadChecks(tasks, store, warnings)));
        warnings.removeAll(state.setupWarnings());
        updates.put("setupWarnings", warnings);
        return updates;
    }

    static Map<String, String> loadChecks(List<TaskDescriptor> tasks, ArtifactStore store, List<String> warnings) {
        var checks = new HashMap<String, String>();
        for (TaskDescriptor task : tasks) {
            if (store.hasCheck(task.identity())) {
                checks.put(task.identity(), store.checkPath(task.identity()).toString());
            } else {
                warnings.add("No check produced for " + task.identity());
            }
        }
        return checks;
    }
}
