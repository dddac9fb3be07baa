package com.mendloop.dispatch.cli;

import com.mendloop.core.events.LoopEvent;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.ValidationResult;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Mendloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MENDLOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MENDLOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(LoopStatus status) {
        String color = switch (status) {
            case DONE_PASS -> "fg(green)";
            case DONE_CEILING -> "fg(yellow)";
            case ABORTED -> "fg(red)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|bold," + color + " " + status + "|@"));
    }

    public static void validation(ValidationResult v) {
        if (v == null) {
            System.out.println("Validation: none recorded");
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Validation: " + v.total() + " total, @|fg(green) " + v.passed() + " passed|@"
                + (v.failed() > 0 ? ", @|fg(red) " + v.failed() + " failed|@" : "")));
        for (ValidationResult.FailedItem item : v.failedItems()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + item.name() + (item.message() != null ? ": " + item.message() : "")));
        }
    }

    /**
     * One progress line per loop event. Per-job start events are left to the log file.
     */
    public static void event(LoopEvent event) {
        Map<String, Object> p = event.payload() != null ? event.payload() : Map.of();
        String line = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@ " + event.runId() + " started: "
                    + p.get("tasks") + " task(s), max " + p.get("maxIterations") + " iteration(s)";
            case "phase.started" -> "@|bold,fg(yellow) [" + p.get("phase") + "]|@ iteration " + p.get("iteration");
            case "phase.skipped" -> "@|fg(white) [" + p.get("phase") + "]|@ skipped: " + p.get("reason");
            case "job.completed" -> jobLine(event.taskId(), p);
            case "work.completed" -> "@|fg(blue) [WORK]|@ " + p.get("succeeded") + "/" + p.get("tasks")
                    + " task(s) succeeded";
            case "validation.completed" -> "@|fg(magenta) [VALIDATION]|@ " + p.get("passed") + "/" + p.get("total")
                    + " passed, " + p.get("failed") + " failed -> " + p.get("next");
            case "iteration.advanced" -> "@|fg(cyan) [ITERATION]|@ advancing to " + p.get("iteration");
            case "run.finished" -> "DONE_PASS".equals(p.get("status"))
                    ? "@|fg(green),bold [FINISHED]|@ " + p.get("status")
                    : "@|fg(red),bold [FINISHED]|@ " + p.get("status");
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    private static String jobLine(String taskId, Map<String, Object> p) {
        String outcome = String.valueOf(p.get("outcome"));
        String color = "SUCCEEDED".equals(outcome) ? "fg(green)" : "fg(red)";
        Object durationMs = p.get("durationMs");
        return "  @|" + color + " " + outcome + "|@ " + p.get("phase") + " " + taskId
                + (durationMs instanceof Number n ? " (" + formatDuration(n.longValue()) + ")" : "");
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
