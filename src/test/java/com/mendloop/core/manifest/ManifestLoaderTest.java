package com.mendloop.core.manifest;

import com.mendloop.core.model.TaskDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestLoaderTest {

    private ManifestLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ManifestLoader();
    }

    @Test
    @DisplayName("loads the fixture manifest in file order")
    void loadsFixture() throws Exception {
        Path manifest = Path.of(getClass().getResource("/fixtures/manifest.json").toURI());

        List<TaskDescriptor> tasks = loader.load(manifest);

        assertEquals(3, tasks.size());
        assertEquals("PathViolations/UsesPathGetFullPath", tasks.get(0).identity());
        assertEquals("Expander_UsesPathGetFullPath", tasks.get(0).originalIdentity());
        assertEquals("src/Build/Evaluation/Expander.cs", tasks.get(0).sourceLocation());
        assertEquals("ComplexViolations", tasks.get(2).category());
    }

    @Test
    @DisplayName("originalIdentity defaults to identity")
    void originalIdentityDefaults() {
        List<TaskDescriptor> tasks = loader.parse("""
                [{"identity": "PathViolations/UsesFileExists", "sourceLocation": "src/Tasks/Copy.cs"}]
                """);

        assertEquals("PathViolations/UsesFileExists", tasks.get(0).originalIdentity());
        assertEquals("", tasks.get(0).category());
    }

    @Test
    @DisplayName("accepts an object keyed by identity")
    void keyedObject() {
        List<TaskDescriptor> tasks = loader.parse("""
                {"TASK-1": {"path": "a.cs", "group": "PathViolations"},
                 "TASK-2": {"id": "Renamed", "path": "b.cs"}}
                """);

        assertEquals(List.of("TASK-1", "Renamed"), tasks.stream().map(TaskDescriptor::identity).toList());
        assertEquals("a.cs", tasks.get(0).sourceLocation());
        assertEquals("PathViolations", tasks.get(0).category());
    }

    @Test
    @DisplayName("an empty task list is valid")
    void emptyTasks() {
        assertTrue(loader.parse("{\"tasks\": []}").isEmpty());
    }

    @Test
    @DisplayName("rejects duplicate identities")
    void rejectsDuplicates() {
        var e = assertThrows(ManifestException.class, () -> loader.parse("""
                [{"identity": "A"}, {"identity": "B"}, {"identity": "A"}]
                """));
        assertTrue(e.getMessage().contains("[A]"));
    }

    @Test
    @DisplayName("rejects entries without identity")
    void rejectsMissingIdentity() {
        assertThrows(ManifestException.class, () -> loader.parse("[{\"sourceLocation\": \"a.cs\"}]"));
    }

    @Test
    @DisplayName("rejects malformed JSON and non-array tasks")
    void rejectsMalformed() {
        assertThrows(ManifestException.class, () -> loader.parse("{not json"));
        assertThrows(ManifestException.class, () -> loader.parse("{\"tasks\": {}}"));
        assertThrows(ManifestException.class, () -> loader.parse("42"));
    }

    @Test
    @DisplayName("missing file is a ManifestException")
    void missingFile(@TempDir Path dir) {
        assertThrows(ManifestException.class, () -> loader.load(dir.resolve("absent.json")));
    }

    @Test
    @DisplayName("load reads from disk")
    void loadFromDisk(@TempDir Path dir) throws Exception {
        Path manifest = dir.resolve("manifest.json");
        Files.writeString(manifest, "{\"tasks\": [{\"identity\": \"X\"}]}");

        assertEquals("X", loader.load(manifest).get(0).identity());
    }
}
