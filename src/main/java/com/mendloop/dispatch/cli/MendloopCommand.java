package com.mendloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root CLI command for Mendloop.
 * Prints banner and usage when invoked without a subcommand.
 */
@Command(
        name = "mendloop",
        mixinStandardHelpOptions = true,
        version = "Mendloop 0.1.0",
        description = "Drives a fixed task queue through a worker pool until external validation passes",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                TasksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MendloopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        CommandLine.usage(this, System.out);
    }
}
