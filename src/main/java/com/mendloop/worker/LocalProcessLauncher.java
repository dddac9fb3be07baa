package com.mendloop.worker;

import com.mendloop.core.model.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Launches workers as local child processes.
 *
 * <p>The job payload is written to a temporary file whose path is substituted into the
 * configured command template. Stdout and stderr are merged and redirected straight into
 * the job's log file, so a chatty worker can never block on a full pipe.
 */
public class LocalProcessLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    private final WorkerProperties properties;

    public LocalProcessLauncher(WorkerProperties properties) {
        this.properties = properties;
    }

    @Override
    public WorkerProcess launch(JobSpec spec) throws IOException {
        Path logPath = Path.of(spec.logPath());
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        Path payloadFile = Files.createTempFile("mendloop-payload-", ".md");
        Files.writeString(payloadFile, spec.payload() != null ? spec.payload() : "", StandardCharsets.UTF_8);

        List<String> command = buildCommand(properties.getCommand(), properties.getContextFlag(), spec, payloadFile);
        log.debug("Starting {}: {}", spec.label(), command);

        try {
            Process process = new ProcessBuilder(command)
                    .directory(new File(spec.workingDirectory()))
                    .redirectErrorStream(true)
                    .redirectOutput(logPath.toFile())
                    .start();
            return new LocalWorkerProcess(process, payloadFile, logPath, properties.getMaxOutputChars());
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(payloadFile);
            throw e;
        }
    }

    @Override
    public boolean isAvailable() {
        List<String> command = properties.getCommand();
        if (command == null || command.isEmpty()) {
            return false;
        }
        String executable = command.get(0);
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String pathEnv = System.getenv().getOrDefault("PATH", "");
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders the command template for one job. Placeholders are replaced inside every
     * argument; each extra context directory is appended after {@code contextFlag}.
     */
    static List<String> buildCommand(List<String> template, String contextFlag, JobSpec spec, Path payloadFile) {
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("Worker command template is empty");
        }
        Map<String, String> values = Map.of(
                "{payloadFile}", payloadFile.toString(),
                "{model}", spec.model() != null ? spec.model() : "",
                "{logPath}", spec.logPath() != null ? spec.logPath() : "",
                "{sharePath}", (spec.logPath() != null ? spec.logPath() : "worker") + ".share.md",
                "{label}", spec.label() != null ? spec.label() : "");

        var command = new ArrayList<String>(template.size() + spec.extraContext().size() * 2);
        for (String arg : template) {
            String rendered = arg;
            for (var entry : values.entrySet()) {
                rendered = rendered.replace(entry.getKey(), entry.getValue());
            }
            command.add(rendered);
        }
        if (contextFlag != null && !contextFlag.isBlank()) {
            for (String dir : spec.extraContext()) {
                command.add(contextFlag);
                command.add(dir);
            }
        }
        return command;
    }

    /**
     * Reads a worker log keeping only its head and tail when it exceeds {@code maxChars} bytes.
     * Only the kept bytes are loaded. A non-positive limit reads the whole log.
     */
    static String readOutput(Path logPath, int maxChars) throws IOException {
        long size = Files.size(logPath);
        if (maxChars <= 0 || size <= maxChars) {
            return new String(Files.readAllBytes(logPath), StandardCharsets.UTF_8);
        }
        int headSize = maxChars / 2;
        int tailSize = maxChars - headSize;
        try (SeekableByteChannel channel = Files.newByteChannel(logPath)) {
            ByteBuffer head = ByteBuffer.allocate(headSize);
            readFully(channel, head);
            channel.position(size - tailSize);
            ByteBuffer tail = ByteBuffer.allocate(tailSize);
            readFully(channel, tail);
            return decode(head)
                    + "\n\n... [truncated " + (size - maxChars) + " bytes] ...\n\n"
                    + decode(tail);
        }
    }

    private static void readFully(SeekableByteChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                return;
            }
        }
    }

    private static String decode(ByteBuffer buffer) {
        return new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
    }

    static final class LocalWorkerProcess implements WorkerProcess {

        private final Process process;
        private final Path payloadFile;
        private final Path logPath;
        private final int maxOutputChars;

        LocalWorkerProcess(Process process, Path payloadFile, Path logPath, int maxOutputChars) {
            this.process = process;
            this.payloadFile = payloadFile;
            this.logPath = logPath;
            this.maxOutputChars = maxOutputChars;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public int exitCode() {
            return process.exitValue();
        }

        @Override
        public String output() {
            if (!Files.isRegularFile(logPath)) {
                return "";
            }
            try {
                return readOutput(logPath, maxOutputChars);
            } catch (IOException e) {
                log.warn("Could not read worker log {}: {}", logPath, e.getMessage());
                return "[output unavailable: " + e.getMessage() + "]";
            }
        }

        @Override
        public void destroy() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public void release() {
            try {
                Files.deleteIfExists(payloadFile);
            } catch (IOException e) {
                log.warn("Failed to clean up payload file {}: {}", payloadFile, e.getMessage());
            }
        }
    }
}
