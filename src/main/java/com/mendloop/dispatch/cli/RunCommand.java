package com.mendloop.dispatch.cli;

import com.mendloop.core.engine.ConvergenceEngine;
import com.mendloop.core.engine.LoopProperties;
import com.mendloop.core.engine.RunOutcome;
import com.mendloop.core.engine.RunRequest;
import com.mendloop.core.events.EventBus;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: mendloop run [--resume | --from-phase &lt;phase&gt; [--iteration &lt;n&gt;]]
 * <p>
 * Runs the convergence loop over the manifest and prints live progress from the event bus.
 * The exit code mirrors the report: 0 validation passed, 1 iteration ceiling, 2 aborted.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Run the loop until validation passes or the iteration ceiling is reached")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--manifest", "-m"}, description = "Task manifest (default: mendloop.loop.manifest)")
    private Path manifest;

    @Option(names = {"--resume", "-r"}, description = "Continue from the last checkpoint")
    private boolean resume;

    @Option(names = {"--from-phase"}, converter = PhaseConverter.class,
            description = "Phase to enter at: propose-fix, scaffold-checks, apply-work, verify-work, "
                    + "run-validation, analyze-failures, finalize")
    private LoopPhase fromPhase;

    @Option(names = {"--iteration"}, description = "Iteration to enter at")
    private Integer iteration;

    @Option(names = {"--max-iterations"}, description = "Iteration ceiling (default: mendloop.loop.max-iterations)")
    private Integer maxIterations;

    @Option(names = {"--quiet", "-q"}, description = "Print only the final outcome")
    private boolean quiet;

    private final ConvergenceEngine engine;
    private final EventBus eventBus;
    private final LoopProperties properties;

    public RunCommand(ConvergenceEngine engine, EventBus eventBus, LoopProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (iteration != null && iteration < 1) {
            ConsoleOutput.error("--iteration must be >= 1, was " + iteration);
            return CommandLine.ExitCode.USAGE;
        }
        if (maxIterations != null && maxIterations < 1) {
            ConsoleOutput.error("--max-iterations must be >= 1, was " + maxIterations);
            return CommandLine.ExitCode.USAGE;
        }

        Path manifestPath = manifest != null ? manifest : Path.of(properties.getManifest());
        RunRequest request = new RunRequest(manifestPath, resume, fromPhase, iteration, maxIterations);

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(ConsoleOutput::event);
        Thread shutdownHook = new Thread(engine::abort, "mendloop-abort");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        RunOutcome outcome;
        try {
            outcome = engine.run(request);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            removeShutdownHook(shutdownHook);
        }

        printOutcome(outcome);
        return outcome.exitCode();
    }

    static void printOutcome(RunOutcome outcome) {
        System.out.println();
        System.out.println("RUN " + outcome.runId());
        ConsoleOutput.status(outcome.status());
        System.out.println("Iterations: " + outcome.iterations());
        ConsoleOutput.validation(outcome.validation());
        if (outcome.reportPath() != null) {
            ConsoleOutput.info("Report: " + outcome.reportPath());
        }
        if (outcome.status() == LoopStatus.DONE_PASS) {
            ConsoleOutput.success("Validation passed.");
        } else if (outcome.status() == LoopStatus.DONE_CEILING) {
            ConsoleOutput.warn("Iteration ceiling reached before validation passed.");
        } else {
            ConsoleOutput.error("Run aborted: " + outcome.error());
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM shutting down, abort hook already running");
        }
    }

    public static class PhaseConverter implements CommandLine.ITypeConverter<LoopPhase> {
        @Override
        public LoopPhase convert(String value) {
            try {
                return LoopPhase.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
