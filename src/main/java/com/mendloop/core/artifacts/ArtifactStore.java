package com.mendloop.core.artifacts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mendloop.core.engine.LoopProperties;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed home of every durable phase output.
 *
 * <p>Layout under the artifact root:
 * <pre>
 *   plans/&lt;task&gt;.md                       propose-fix output
 *   checks/&lt;task&gt;.md                      scaffold-checks output
 *   harness.md                             shared check harness notes
 *   guidance/iteration-&lt;n&gt;.md              analyze-failures output
 *   logs/iteration-&lt;n&gt;/&lt;phase&gt;/&lt;task&gt;.log   worker output, one file per (phase, task, iteration)
 *   logs/iteration-&lt;n&gt;/&lt;phase&gt;/_shared/&lt;job&gt;.log   output of jobs serving the whole queue
 *   checkpoint.json                        written after every phase
 *   run-report.json                        written once per run
 *   run-sequence                           last issued run number
 * </pre>
 * Task identities are URL-encoded into single file names, so distinct identities never share a
 * file and no identity reaches the shared harness notes or the {@code _shared} log directory.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    static final String HARNESS_FILE = "harness.md";
    static final String SHARED_LOG_DIR = "_shared";

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public ArtifactStore(LoopProperties properties) {
        this(Path.of(properties.getArtifactDir()));
    }

    public ArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path root() {
        return root;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    // -- Paths (pure) --

    public Path plansDir() {
        return root.resolve("plans");
    }

    public Path checksDir() {
        return root.resolve("checks");
    }

    public Path guidanceDir() {
        return root.resolve("guidance");
    }

    public Path planPath(String identity) {
        return plansDir().resolve(fileName(identity) + ".md");
    }

    public Path checkPath(String identity) {
        return checksDir().resolve(fileName(identity) + ".md");
    }

    public Path harnessPath() {
        return root.resolve(HARNESS_FILE);
    }

    public Path guidancePath(int iteration) {
        return guidanceDir().resolve("iteration-" + iteration + ".md");
    }

    /**
     * Log file for one job. Keyed by (phase, task identity, iteration), unique by construction.
     */
    public Path logPath(LoopPhase phase, String identity, int iteration) {
        return phaseLogDir(phase, iteration).resolve(fileName(identity) + ".log");
    }

    /**
     * Log file for a job serving the whole queue, such as the check harness setup.
     */
    public Path sharedLogPath(LoopPhase phase, String jobName, int iteration) {
        return phaseLogDir(phase, iteration).resolve(SHARED_LOG_DIR).resolve(fileName(jobName) + ".log");
    }

    private Path phaseLogDir(LoopPhase phase, int iteration) {
        return root.resolve("logs").resolve("iteration-" + iteration).resolve(phase.slug());
    }

    public Path checkpointPath() {
        return root.resolve("checkpoint.json");
    }

    public Path reportPath() {
        return root.resolve("run-report.json");
    }

    public Path runSequencePath() {
        return root.resolve("run-sequence");
    }

    /**
     * Encodes an identity into a single path segment. Reversible, so two identities never collide.
     */
    static String fileName(String identity) {
        String encoded = URLEncoder.encode(identity, StandardCharsets.UTF_8)
                .replace("*", "%2A");
        if (encoded.equals(".") || encoded.equals("..")) {
            return encoded.replace(".", "%2E");
        }
        return encoded;
    }

    /**
     * Creates the directories workers write plans, checks and guidance into.
     */
    public void prepare() {
        for (Path dir : List.of(plansDir(), checksDir(), guidanceDir())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new ArtifactStoreException("Failed to create " + dir, e);
            }
        }
    }

    // -- Plans and checks --

    public Optional<String> readPlan(String identity) {
        return readIfPresent(planPath(identity));
    }

    public boolean hasAllPlans(List<TaskDescriptor> tasks) {
        return !tasks.isEmpty() && tasks.stream().allMatch(t -> Files.isRegularFile(planPath(t.identity())));
    }

    public boolean hasCheck(String identity) {
        return Files.isRegularFile(checkPath(identity));
    }

    public boolean hasAllChecks(List<TaskDescriptor> tasks) {
        return !tasks.isEmpty() && tasks.stream().allMatch(t -> hasCheck(t.identity()));
    }

    public void discardPlans() {
        deleteContents(plansDir());
    }

    public void discardChecks() {
        deleteContents(checksDir());
        try {
            Files.deleteIfExists(harnessPath());
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to discard " + harnessPath(), e);
        }
    }

    // -- Guidance --

    public Optional<String> readGuidance(int iteration) {
        return readIfPresent(guidancePath(iteration));
    }

    /**
     * Every guidance text written before {@code iteration}, oldest first.
     */
    public List<String> guidanceBefore(int iteration) {
        var all = new ArrayList<String>();
        for (int i = 1; i < iteration; i++) {
            readGuidance(i).ifPresent(all::add);
        }
        return all;
    }

    public void discardGuidance(int iteration) {
        try {
            Files.deleteIfExists(guidancePath(iteration));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to discard " + guidancePath(iteration), e);
        }
    }

    public void writeGuidance(int iteration, String guidance) {
        writeAtomically(guidancePath(iteration), guidance);
    }

    // -- Checkpoint --

    public void writeCheckpoint(LoopCheckpoint checkpoint) {
        try {
            writeAtomically(checkpointPath(), objectMapper.writeValueAsString(checkpoint));
            log.debug("Checkpoint written after {} (iteration {})",
                    checkpoint.completedPhase().slug(), checkpoint.iteration());
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to serialize checkpoint", e);
        }
    }

    public void discardCheckpoint() {
        try {
            Files.deleteIfExists(checkpointPath());
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to discard " + checkpointPath(), e);
        }
    }

    public Optional<LoopCheckpoint> readCheckpoint() {
        Path path = checkpointPath();
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), LoopCheckpoint.class));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read checkpoint " + path, e);
        }
    }

    // -- Run sequence --

    /**
     * Increments and returns the persisted run number, starting at 1. An unreadable
     * sequence file restarts the count.
     */
    public synchronized int nextRunSequence() {
        Path path = runSequencePath();
        int last = 0;
        if (Files.isRegularFile(path)) {
            try {
                last = Integer.parseInt(Files.readString(path).trim());
            } catch (IOException | NumberFormatException e) {
                log.warn("Run sequence {} unreadable, restarting at 1: {}", path, e.getMessage());
            }
        }
        int next = last + 1;
        writeAtomically(path, Integer.toString(next));
        return next;
    }

    // -- Report --

    public Path writeReport(Object report) {
        Path path = reportPath();
        try {
            writeAtomically(path, objectMapper.writeValueAsString(report));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to serialize run report", e);
        }
        return path;
    }

    // -- Helpers --

    private void ensureParent(Path file) {
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to create directory for " + file, e);
        }
    }

    private Optional<String> readIfPresent(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(path);
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read " + path, e);
        }
    }

    private void writeAtomically(Path target, String content) {
        ensureParent(target);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write " + target, e);
        }
    }

    private void deleteContents(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                if (Files.isRegularFile(file)) {
                    Files.delete(file);
                }
            }
            log.info("Discarded stale artifacts in {}", dir);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to discard artifacts in " + dir, e);
        }
    }
}
