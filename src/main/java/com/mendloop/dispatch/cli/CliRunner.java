package com.mendloop.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MendloopCommand mendloopCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MendloopCommand mendloopCommand, IFactory factory) {
        this.mendloopCommand = mendloopCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(mendloopCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Usage errors exit with 2, the same code as an aborted run.
     */
    static CommandLine commandLine(MendloopCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
