package com.mendloop.core.phases;

import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.state.LoopState;
import com.mendloop.core.validation.ValidationHarness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The EVALUATING state: one harness invocation for the whole queue, then the loop decision.
 */
@Component
public class RunValidationPhase {

    private static final Logger log = LoggerFactory.getLogger(RunValidationPhase.class);

    static final String HARNESS_LOG = "validation-harness";

    private final PhaseRunner runner;
    private final JobSpecFactory specs;
    private final ValidationHarness harness;

    public RunValidationPhase(PhaseRunner runner, JobSpecFactory specs, ValidationHarness harness) {
        this.runner = runner;
        this.specs = specs;
        this.harness = harness;
    }

    public Map<String, Object> apply(LoopState state) {
        int iteration = state.iteration();
        String runId = state.runId();

        if (state.resumePoint().skips(LoopPhase.RUN_VALIDATION, iteration)) {
            var recorded = recordedValidation(state, iteration);
            if (recorded != null) {
                runner.phaseSkipped(runId, LoopPhase.RUN_VALIDATION, iteration, "validation already recorded");
                var updates = new HashMap<String, Object>();
                updates.put("status", decide(recorded, iteration, state.maxIterations()).name());
                return updates;
            }
            log.info("No validation recorded for iteration {}, running the harness again", iteration);
        }

        runner.phaseStarted(runId, LoopPhase.RUN_VALIDATION, iteration);
        runner.checkNotAborted();
        long start = System.currentTimeMillis();
        Path logPath = specs.store().sharedLogPath(LoopPhase.RUN_VALIDATION, HARNESS_LOG, iteration);
        ValidationResult validation = harness.validate(iteration, logPath);
        runner.checkNotAborted();
        runner.metrics().recordPhaseDuration(LoopPhase.RUN_VALIDATION.slug(), System.currentTimeMillis() - start);
        runner.metrics().recordValidation(validation);

        LoopStatus next = decide(validation, iteration, state.maxIterations());
        log.info("Iteration {} validation: {}/{} passed, {} failed -> {}",
                iteration, validation.passed(), validation.total(), validation.failed(), next);
        runner.publish("validation.completed", runId, Map.of(
                "iteration", iteration,
                "total", validation.total(),
                "passed", validation.passed(),
                "failed", validation.failed(),
                "next", next.name()));

        var updates = new HashMap<String, Object>();
        updates.put("status", next.name());
        updates.put("context", state.context().withLastValidation(validation));
        updates.put("history", List.of(new IterationState(iteration, state.currentWork(), validation)));
        runner.checkpoint(state, updates, LoopPhase.RUN_VALIDATION);
        return updates;
    }

    /**
     * The loop's transition rule: converged wins, then the ceiling, otherwise analyze and retry.
     */
    public static LoopStatus decide(ValidationResult validation, int iteration, int maxIterations) {
        if (validation.converged()) {
            return LoopStatus.DONE_PASS;
        }
        if (iteration >= maxIterations) {
            return LoopStatus.DONE_CEILING;
        }
        return LoopStatus.ANALYZING;
    }

    private static ValidationResult recordedValidation(LoopState state, int iteration) {
        for (IterationState recorded : state.history()) {
            if (recorded.iteration() == iteration && recorded.validation() != null) {
                return recorded.validation();
            }
        }
        return null;
    }
}
