package com.mendloop.core.phases;

import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.report.ReportWriter;
import com.mendloop.core.report.RunReport;
import com.mendloop.core.state.LoopState;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs once, on whichever DONE transition ends the loop, and writes the run report.
 */
@Component
public class FinalizePhase {

    private final PhaseRunner runner;
    private final ReportWriter reportWriter;

    public FinalizePhase(PhaseRunner runner, ReportWriter reportWriter) {
        this.runner = runner;
        this.reportWriter = reportWriter;
    }

    public Map<String, Object> apply(LoopState state) {
        LoopStatus status = state.status();
        runner.phaseStarted(state.runId(), LoopPhase.FINALIZE, state.iteration());

        RunReport report = reportWriter.compose(state.toCheckpoint(LoopPhase.FINALIZE), state.tasks(), status, null);
        Path path = reportWriter.write(report);
        runner.metrics().recordRunResult(status.name());
        runner.publish("run.finished", state.runId(), Map.of(
                "status", status.name(),
                "iterations", state.iteration(),
                "reportPath", path.toString()));

        var updates = new HashMap<String, Object>();
        updates.put("reportPath", path.toString());
        runner.checkpoint(state, updates, LoopPhase.FINALIZE);
        return updates;
    }
}
