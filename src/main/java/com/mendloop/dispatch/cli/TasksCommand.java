package com.mendloop.dispatch.cli;

import com.mendloop.core.engine.LoopProperties;
import com.mendloop.core.manifest.ManifestException;
import com.mendloop.core.manifest.ManifestLoader;
import com.mendloop.core.model.TaskDescriptor;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: mendloop tasks
 * <p>
 * Lists the manifest in queue order, grouped by category on request.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List the tasks in the manifest")
@Component
public class TasksCommand implements Callable<Integer> {

    @Option(names = {"--manifest", "-m"}, description = "Task manifest (default: mendloop.loop.manifest)")
    private Path manifest;

    @Option(names = {"--by-category", "-c"}, description = "Count tasks per category")
    private boolean byCategory;

    private final ManifestLoader manifestLoader;
    private final LoopProperties properties;

    public TasksCommand(ManifestLoader manifestLoader, LoopProperties properties) {
        this.manifestLoader = manifestLoader;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Path manifestPath = manifest != null ? manifest : Path.of(properties.getManifest());
        List<TaskDescriptor> tasks;
        try {
            tasks = manifestLoader.load(manifestPath);
        } catch (ManifestException e) {
            ConsoleOutput.error(e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        if (byCategory) {
            Map<String, Integer> counts = new TreeMap<>();
            for (TaskDescriptor task : tasks) {
                counts.merge(task.category().isEmpty() ? "(none)" : task.category(), 1, Integer::sum);
            }
            counts.forEach((category, count) -> System.out.printf("  %-40s %d%n", category, count));
        } else {
            for (int i = 0; i < tasks.size(); i++) {
                TaskDescriptor task = tasks.get(i);
                System.out.printf("%4d. [%s] %s  %s%n", i + 1, task.category(), task.identity(), task.sourceLocation());
            }
        }
        ConsoleOutput.info(tasks.size() + " task(s) in " + manifestPath);
        return CommandLine.ExitCode.OK;
    }
}
