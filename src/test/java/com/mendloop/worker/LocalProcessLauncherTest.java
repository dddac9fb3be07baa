package com.mendloop.worker;

import com.mendloop.core.model.JobSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LocalProcessLauncherTest {

    @TempDir
    Path tempDir;

    private JobSpec spec(String logPath, List<String> extraContext) {
        return new JobSpec("Fix the path handling", tempDir.toString(), logPath,
                "apply-work:PathViolations/UsesFileExists#2", extraContext, "gpt-large", null);
    }

    @Test
    @DisplayName("buildCommand substitutes every placeholder")
    void substitutesPlaceholders() {
        var template = List.of("worker", "--model", "{model}", "--prompt-file", "{payloadFile}",
                "--share", "{sharePath}", "--log={logPath}", "--name", "{label}");

        List<String> command = LocalProcessLauncher.buildCommand(template, "--add-dir",
                spec("/logs/apply.log", List.of()), Path.of("/tmp/payload.md"));

        assertEquals(List.of("worker", "--model", "gpt-large", "--prompt-file", "/tmp/payload.md",
                "--share", "/logs/apply.log.share.md", "--log=/logs/apply.log", "--name",
                "apply-work:PathViolations/UsesFileExists#2"), command);
    }

    @Test
    @DisplayName("buildCommand appends the context flag once per extra directory")
    void appendsContextDirectories() {
        List<String> command = LocalProcessLauncher.buildCommand(List.of("worker", "{payloadFile}"), "--add-dir",
                spec("/logs/a.log", List.of("/repo/docs", "/repo/.mendloop")), Path.of("/tmp/p.md"));

        assertEquals(List.of("worker", "/tmp/p.md", "--add-dir", "/repo/docs", "--add-dir", "/repo/.mendloop"), command);
    }

    @Test
    @DisplayName("buildCommand skips context directories without a flag")
    void noContextFlag() {
        List<String> command = LocalProcessLauncher.buildCommand(List.of("worker"), "",
                spec("/logs/a.log", List.of("/repo/docs")), Path.of("/tmp/p.md"));

        assertEquals(List.of("worker"), command);
    }

    @Test
    @DisplayName("buildCommand rejects an empty template")
    void rejectsEmptyTemplate() {
        assertThrows(IllegalArgumentException.class, () -> LocalProcessLauncher.buildCommand(
                List.of(), "--add-dir", spec("/logs/a.log", List.of()), Path.of("/tmp/p.md")));
    }

    @Test
    @DisplayName("readOutput keeps only head and tail of a long log")
    void truncatesOutput() throws Exception {
        Path log = tempDir.resolve("long.log");
        Files.writeString(log, "A".repeat(50) + "B".repeat(100_000) + "C".repeat(50));

        String truncated = LocalProcessLauncher.readOutput(log, 100);

        assertTrue(truncated.startsWith("A".repeat(50) + "\n"));
        assertTrue(truncated.endsWith("\n" + "C".repeat(50)));
        assertTrue(truncated.contains("[truncated 100000 bytes]"));
        assertFalse(truncated.contains("B"));
    }

    @Test
    @DisplayName("readOutput returns a short log whole")
    void shortOutput() throws Exception {
        Path log = tempDir.resolve("short.log");
        Files.writeString(log, "short");

        assertEquals("short", LocalProcessLauncher.readOutput(log, 100));
        assertEquals("short", LocalProcessLauncher.readOutput(log, 0));
    }

    @Test
    @DisplayName("launches a real process, logs its output and removes the payload file")
    void launchesRealProcess() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "requires /bin/sh");
        var properties = new WorkerProperties();
        properties.setCommand(List.of("/bin/sh", "-c", "cat \"$0\"; echo done; exit 3", "{payloadFile}"));
        properties.setContextFlag("");
        var launcher = new LocalProcessLauncher(properties);
        Path logPath = tempDir.resolve("logs/apply-work/task.iter-1.log");
        long payloadsBefore = payloadFiles();

        WorkerProcess process = launcher.launch(spec(logPath.toString(), List.of()));
        long waitUntil = System.currentTimeMillis() + 10_000;
        while (process.isAlive() && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }

        assertFalse(process.isAlive());
        assertEquals(3, process.exitCode());
        assertTrue(process.output().contains("Fix the path handling"));
        assertTrue(Files.readString(logPath).contains("done"));
        assertEquals(payloadsBefore + 1, payloadFiles());
        process.release();
        assertEquals(payloadsBefore, payloadFiles());
    }

    private static long payloadFiles() throws Exception {
        try (var files = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return files.filter(p -> p.getFileName().toString().startsWith("mendloop-payload-")).count();
        }
    }

    @Test
    @DisplayName("isAvailable is false for a missing executable")
    void missingExecutable() {
        var properties = new WorkerProperties();
        properties.setCommand(List.of("definitely-not-a-mendloop-worker"));

        assertFalse(new LocalProcessLauncher(properties).isAvailable());
    }
}
