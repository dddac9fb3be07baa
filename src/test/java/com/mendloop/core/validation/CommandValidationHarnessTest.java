package com.mendloop.core.validation;

import com.mendloop.core.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CommandValidationHarnessTest {

    @TempDir
    Path workingDir;

    private ValidationProperties properties;

    @BeforeEach
    void setUp() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "requires /bin/sh");
        properties = new ValidationProperties();
        properties.setReportPath("out/report.json");
        properties.setTimeoutSeconds(30);
    }

    private void script(String body) throws Exception {
        Files.writeString(workingDir.resolve("validate.sh"), body);
        properties.setCommand(List.of("/bin/sh", "validate.sh", "{reportPath}", "{iteration}"));
    }

    @Test
    @DisplayName("buildCommand substitutes report path and iteration")
    void buildCommand() {
        assertEquals(List.of("./validate.sh", "--report", "/r.json", "--iteration=2"),
                CommandValidationHarness.buildCommand(
                        List.of("./validate.sh", "--report", "{reportPath}", "--iteration={iteration}"),
                        Path.of("/r.json"), 2));
    }

    @Test
    @DisplayName("runs the harness and reads its report regardless of exit code")
    void readsReport() throws Exception {
        script("""
                mkdir -p "$(dirname "$1")"
                echo "iteration $2"
                printf '{"total": 2, "passed": 1, "failed": 1, "failures": [{"name": "A_Test", "message": "still relative"}]}' > "$1"
                exit 1
                """);
        var harness = new CommandValidationHarness(properties, workingDir);
        Path log = workingDir.resolve("logs/validation.log");

        ValidationResult result = harness.validate(2, log);

        assertEquals(1, result.failed());
        assertEquals("A_Test", result.failedItems().get(0).name());
        assertTrue(Files.readString(log).contains("iteration 2"));
    }

    @Test
    @DisplayName("a stale report is not reused when the harness writes none")
    void staleReportDeleted() throws Exception {
        Path report = workingDir.resolve("out/report.json");
        Files.createDirectories(report.getParent());
        Files.writeString(report, "{\"total\": 1, \"passed\": 1, \"failed\": 0}");
        script("exit 0\n");

        ValidationResult result = new CommandValidationHarness(properties, workingDir)
                .validate(1, workingDir.resolve("logs/validation.log"));

        assertFalse(result.converged());
        assertTrue(result.failedItems().get(0).message().contains("not found"));
    }

    @Test
    @DisplayName("a harness that cannot start is fatal")
    void missingExecutable() {
        properties.setCommand(List.of(workingDir.resolve("no-such-harness").toString()));
        var harness = new CommandValidationHarness(properties, workingDir);

        assertThrows(ValidationHarnessMissingException.class, harness::verifyAvailable);
        assertThrows(ValidationHarnessMissingException.class,
                () -> harness.validate(1, workingDir.resolve("logs/validation.log")));
    }

    @Test
    @DisplayName("verifyAvailable resolves relative entry points against the working directory")
    void verifyRelative() throws Exception {
        Files.writeString(workingDir.resolve("validate.sh"), "exit 0\n");
        properties.setCommand(List.of("./validate.sh", "{reportPath}"));

        assertDoesNotThrow(() -> new CommandValidationHarness(properties, workingDir).verifyAvailable());
    }

    @Test
    @DisplayName("verifyAvailable rejects an empty command")
    void emptyCommand() {
        properties.setCommand(List.of());
        assertThrows(ValidationHarnessMissingException.class,
                () -> new CommandValidationHarness(properties, workingDir).verifyAvailable());
    }

    @Test
    @DisplayName("a harness past its timeout yields an unusable result")
    void timeout() throws Exception {
        properties.setTimeoutSeconds(1);
        script("sleep 30\n");

        ValidationResult result = new CommandValidationHarness(properties, workingDir)
                .validate(1, workingDir.resolve("logs/validation.log"));

        assertFalse(result.converged());
        assertTrue(result.failedItems().get(0).message().contains("timed out"));
    }
}
