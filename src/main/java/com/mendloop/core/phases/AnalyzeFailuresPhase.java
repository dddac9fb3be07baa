package com.mendloop.core.phases;

import com.mendloop.core.analysis.RegressionDetector;
import com.mendloop.core.analysis.RegressionDetector.Regression;
import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.state.LoopState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The ANALYZING state: one job reads the failures and writes {@code guidance/iteration-<n>.md},
 * which becomes the context guidance of iteration n + 1. When the job leaves no guidance
 * behind, a digest of the failures is written in its place so the next iteration and any
 * resume see the same text.
 */
@Component
public class AnalyzeFailuresPhase {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeFailuresPhase.class);

    static final String ANALYSIS_TASK = "failure-analysis";

    private final PhaseRunner runner;
    private final JobSpecFactory specs;
    private final RegressionDetector regressionDetector;

    public AnalyzeFailuresPhase(PhaseRunner runner, JobSpecFactory specs, RegressionDetector regressionDetector) {
        this.runner = runner;
        this.specs = specs;
        this.regressionDetector = regressionDetector;
    }

    public Map<String, Object> apply(LoopState state) {
        ArtifactStore store = specs.store();
        int iteration = state.iteration();
        String runId = state.runId();
        PhaseContext context = state.context();
        List<IterationState> history = state.history();
        ValidationResult validation = state.latestValidation()
                .orElseGet(() -> ValidationResult.unusable("No validation recorded for iteration " + iteration));

        List<Regression> regressions = history.size() < 2
                ? List.of()
                : regressionDetector.regressionsBetween(history.get(history.size() - 2), history.get(history.size() - 1));
        List<String> oscillating = regressionDetector.oscillating(history);
        if (!regressions.isEmpty()) {
            log.warn("{} validation item(s) regressed in iteration {}", regressions.size(), iteration);
        }

        runner.phaseStarted(runId, LoopPhase.ANALYZE_FAILURES, iteration);
        String guidancePath = store.guidancePath(iteration).toString();
        store.discardGuidance(iteration);
        JobResult result = runner.run(runId, LoopPhase.ANALYZE_FAILURES, iteration,
                List.of(TaskDescriptor.shared(ANALYSIS_TASK)), context,
                (task, ctx) -> specs.createShared(LoopPhase.ANALYZE_FAILURES, task, ctx.iteration(),
                        InstructionBuilder.analyzeFailures(iteration, validation, state.currentWork(),
                                regressions, oscillating, ctx, guidancePath))).get(0);

        String guidance = store.readGuidance(iteration).orElse(null);
        if (guidance == null) {
            log.warn("Failure analysis {} (exit code {}) left no guidance, using a failure digest",
                    result.outcome(), result.exitCode());
            guidance = InstructionBuilder.failureDigest(iteration, validation, regressions, oscillating);
            store.writeGuidance(iteration, guidance);
        }

        int next = iteration + 1;
        runner.metrics().recordIterationDepth(next);
        runner.publish("iteration.advanced", runId, Map.of("iteration", next, "regressions", regressions.size()));

        var updates = new HashMap<String, Object>();
        updates.put("status", LoopStatus.WORKING.name());
        updates.put("iteration", next);
        updates.put("context", context.withGuidance(guidance).withIteration(next));
        updates.put("currentWork", List.of());
        runner.checkpoint(state, updates, LoopPhase.ANALYZE_FAILURES);
        return updates;
    }
}
