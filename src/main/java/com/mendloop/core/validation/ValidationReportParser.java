package com.mendloop.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.model.ValidationResult.FailedItem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the harness report:
 * <pre>
 * {"total": 10, "passed": 7, "failed": 3,
 *  "failures": [{"name": "...", "message": "..."}]}
 * </pre>
 * {@code failedItems} is accepted as an alias of {@code failures}. Missing counts are
 * derived from the others where possible; counts that contradict each other make the
 * report unusable. Anything unreadable becomes an unusable result
 * rather than an exception, so the loop keeps iterating on a flaky harness.
 */
public class ValidationReportParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ValidationResult read(Path reportPath) {
        if (!Files.isRegularFile(reportPath)) {
            return ValidationResult.unusable("Validation report not found at " + reportPath);
        }
        try {
            return parse(Files.readString(reportPath));
        } catch (IOException e) {
            return ValidationResult.unusable("Validation report unreadable: " + e.getMessage());
        }
    }

    public ValidationResult parse(String json) {
        if (json == null || json.isBlank()) {
            return ValidationResult.unusable("Validation report is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return ValidationResult.unusable("Validation report is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ValidationResult.unusable("Validation report must be a JSON object");
        }

        List<FailedItem> failures = new ArrayList<>();
        JsonNode items = root.has("failures") ? root.get("failures") : root.path("failedItems");
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (item.isTextual()) {
                    failures.add(new FailedItem(item.asText(), ""));
                } else {
                    failures.add(new FailedItem(item.path("name").asText("unnamed"),
                            item.path("message").asText("")));
                }
            }
        }

        int passed = root.has("passed") ? root.get("passed").asInt() : 0;
        int failed;
        if (root.has("failed")) {
            failed = root.get("failed").asInt();
        } else if (root.has("total")) {
            failed = Math.max(failures.size(), root.get("total").asInt() - passed);
        } else {
            failed = failures.size();
        }
        int total = root.has("total") ? root.get("total").asInt() : passed + failed;
        if (total < 0 || passed < 0 || failed < 0) {
            return ValidationResult.unusable("Validation report has negative counts");
        }
        if (passed > total || passed + failed != total) {
            return ValidationResult.unusable("Validation report counts do not add up: total=" + total
                    + ", passed=" + passed + ", failed=" + failed);
        }
        if (failed > 0 && failures.isEmpty()) {
            failures.add(new FailedItem("unnamed", failed + " failure(s) reported without details"));
        }
        return new ValidationResult(total, passed, failed, failures);
    }
}
