package com.mendloop.core.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mendloop.core.model.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads the static task manifest into an immutable list of {@link TaskDescriptor}s.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code {"tasks": [ {...}, ... ]}}</li>
 *   <li>a bare array {@code [ {...}, ... ]}</li>
 *   <li>an object keyed by task, {@code {"TASK-1": {...}, ...}}, where the key is the
 *       identity unless the entry names one</li>
 * </ul>
 * Each entry carries {@code identity} (or {@code id}), {@code sourceLocation} (or {@code path}),
 * {@code category} and {@code originalIdentity}.
 */
@Component
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<TaskDescriptor> load(Path manifestPath) {
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            throw new ManifestException("Manifest not found: " + manifestPath);
        }
        String json;
        try {
            json = Files.readString(manifestPath);
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest " + manifestPath, e);
        }
        List<TaskDescriptor> tasks = parse(json);
        log.info("Loaded {} tasks from manifest {}", tasks.size(), manifestPath);
        return tasks;
    }

    public List<TaskDescriptor> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Manifest is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ManifestException("Manifest is empty");
        }

        var tasks = new ArrayList<TaskDescriptor>();
        if (root.isArray()) {
            readArray(root, tasks);
        } else if (root.isObject() && root.has("tasks")) {
            JsonNode list = root.get("tasks");
            if (!list.isArray()) {
                throw new ManifestException("Manifest field 'tasks' must be an array");
            }
            readArray(list, tasks);
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                tasks.add(toTask(entry.getValue(), entry.getKey()));
            }
        } else {
            throw new ManifestException("Manifest must be a JSON object or array");
        }

        requireUniqueIdentities(tasks);
        return List.copyOf(tasks);
    }

    private void readArray(JsonNode array, List<TaskDescriptor> tasks) {
        for (JsonNode entry : array) {
            tasks.add(toTask(entry, null));
        }
    }

    private TaskDescriptor toTask(JsonNode entry, String key) {
        if (!entry.isObject()) {
            throw new ManifestException("Manifest entry " + (key != null ? key + " " : "") + "must be an object");
        }
        String identity = text(entry, "identity", "id");
        if (identity == null) {
            identity = key;
        }
        if (identity == null || identity.isBlank()) {
            throw new ManifestException("Manifest entry without identity: " + entry);
        }
        return new TaskDescriptor(
                identity,
                text(entry, "sourceLocation", "path"),
                text(entry, "category", "group"),
                text(entry, "originalIdentity", "originalId"));
    }

    private static String text(JsonNode entry, String field, String alias) {
        JsonNode node = entry.hasNonNull(field) ? entry.get(field) : entry.get(alias);
        return node != null && !node.isNull() ? node.asText() : null;
    }

    private static void requireUniqueIdentities(List<TaskDescriptor> tasks) {
        var seen = new HashSet<String>();
        var duplicates = new ArrayList<String>();
        for (var task : tasks) {
            if (!seen.add(task.identity())) {
                duplicates.add(task.identity());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ManifestException("Duplicate task identities in manifest: " + duplicates);
        }
    }
}
