package com.mendloop.dispatch.cli;

import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.report.ReportWriter;
import com.mendloop.core.report.RunReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: mendloop status
 * <p>
 * Shows where the last run stands: the checkpoint (phase, iteration, resume point) and,
 * once the run finished, its report.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the last checkpoint and run report")
@Component
public class StatusCommand implements Callable<Integer> {

    private final ArtifactStore store;
    private final ReportWriter reportWriter;

    public StatusCommand(ArtifactStore store, ReportWriter reportWriter) {
        this.store = store;
        this.reportWriter = reportWriter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<LoopCheckpoint> checkpoint;
        Optional<RunReport> report;
        try {
            checkpoint = store.readCheckpoint();
            report = reportWriter.read();
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }

        if (checkpoint.isEmpty() && report.isEmpty()) {
            ConsoleOutput.info("No run recorded under " + store.root());
            return CommandLine.ExitCode.OK;
        }

        checkpoint.ifPresent(StatusCommand::printCheckpoint);
        report.ifPresent(StatusCommand::printReport);
        return CommandLine.ExitCode.OK;
    }

    static void printCheckpoint(LoopCheckpoint c) {
        System.out.println();
        System.out.println("RUN " + c.runId());
        ConsoleOutput.status(c.status());
        System.out.printf("Iteration %d of %d, last completed phase: %s%n",
                c.iteration(), c.maxIterations(), c.completedPhase().slug());
        if (!c.status().isTerminal()) {
            var next = c.nextResumePoint();
            ConsoleOutput.info("Resume with 'mendloop run --resume' at " + next.phase().slug()
                    + " (iteration " + next.iteration() + ")");
        }
        for (IterationState s : c.history()) {
            var v = s.validation();
            if (v == null) {
                continue;
            }
            System.out.printf("  iteration %d: %d/%d passed, %d failed%n",
                    s.iteration(), v.passed(), v.total(), v.failed());
        }
        for (String warning : c.setupWarnings()) {
            ConsoleOutput.warn(warning);
        }
    }

    static void printReport(RunReport r) {
        System.out.println();
        System.out.println("REPORT " + r.runId() + " (" + r.finishedAt() + ")");
        ConsoleOutput.status(r.status());
        ConsoleOutput.validation(r.validation());
        for (RunReport.TaskOutcome t : r.tasks()) {
            System.out.printf("  %-50s apply=%s verify=%s%s%n", t.identity(), t.apply(), t.verify(),
                    t.failures().isEmpty() ? "" : " (" + t.failures().size() + " failing)");
        }
        if (!r.regressions().isEmpty()) {
            ConsoleOutput.warn(r.regressions().size() + " regression(s)");
        }
        if (r.error() != null) {
            ConsoleOutput.error(r.error());
        }
    }
}
