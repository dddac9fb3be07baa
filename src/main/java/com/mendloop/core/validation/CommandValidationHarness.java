package com.mendloop.core.validation;

import com.mendloop.core.engine.LoopProperties;
import com.mendloop.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured harness command as a child process, then reads its JSON report.
 *
 * <p>The harness's exit code is logged but not interpreted: harnesses conventionally exit
 * non-zero when tests fail, and the report is the only signal. A stale report from a
 * previous iteration is deleted before the command runs.
 */
@Component
public class CommandValidationHarness implements ValidationHarness {

    private static final Logger log = LoggerFactory.getLogger(CommandValidationHarness.class);

    private final ValidationProperties properties;
    private final Path workingDir;
    private final ValidationReportParser parser = new ValidationReportParser();

    @Autowired
    public CommandValidationHarness(ValidationProperties properties, LoopProperties loopProperties) {
        this(properties, Path.of(loopProperties.getWorkingDir()));
    }

    public CommandValidationHarness(ValidationProperties properties, Path workingDir) {
        this.properties = properties;
        this.workingDir = workingDir.toAbsolutePath().normalize();
    }

    @Override
    public ValidationResult validate(int iteration, Path logPath) {
        Path reportPath = reportPath();
        List<String> command = buildCommand(properties.getCommand(), reportPath, iteration);
        try {
            Files.deleteIfExists(reportPath);
            Files.createDirectories(logPath.getParent());
        } catch (IOException e) {
            return ValidationResult.unusable("Could not prepare validation run: " + e.getMessage());
        }

        log.info("Running validation harness for iteration {}: {}", iteration, command);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logPath.toFile())
                    .start();
        } catch (IOException e) {
            throw new ValidationHarnessMissingException(
                    "Validation harness could not be started: " + command.get(0), e);
        }

        try {
            int timeout = properties.getTimeoutSeconds();
            if (timeout > 0) {
                if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                    process.descendants().forEach(ProcessHandle::destroyForcibly);
                    process.destroyForcibly();
                    log.warn("Validation harness exceeded {}s, terminated", timeout);
                    return ValidationResult.unusable("Validation harness timed out after " + timeout + "s");
                }
            } else {
                process.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            return ValidationResult.unusable("Validation interrupted");
        }

        log.info("Validation harness exited with code {}", process.exitValue());
        ValidationResult result = parser.read(reportPath);
        log.info("Validation iteration {}: {} total, {} passed, {} failed",
                iteration, result.total(), result.passed(), result.failed());
        return result;
    }

    @Override
    public void verifyAvailable() {
        List<String> command = properties.getCommand();
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new ValidationHarnessMissingException("No validation harness command configured (mendloop.validation.command)");
        }
        String executable = command.get(0);
        if (!resolvable(executable)) {
            throw new ValidationHarnessMissingException("Validation harness entry point not found: " + executable);
        }
    }

    Path reportPath() {
        return workingDir.resolve(properties.getReportPath()).normalize();
    }

    static List<String> buildCommand(List<String> template, Path reportPath, int iteration) {
        if (template == null || template.isEmpty()) {
            throw new ValidationHarnessMissingException("No validation harness command configured (mendloop.validation.command)");
        }
        var command = new ArrayList<String>(template.size());
        for (String arg : template) {
            command.add(arg.replace("{reportPath}", reportPath.toString())
                    .replace("{iteration}", String.valueOf(iteration)));
        }
        return command;
    }

    private boolean resolvable(String executable) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            Path path = workingDir.resolve(executable);
            return Files.isRegularFile(path);
        }
        String pathEnv = System.getenv().getOrDefault("PATH", "");
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }
}
