package com.mendloop.core.phases;

import com.mendloop.core.artifacts.ArtifactStore;
import com.mendloop.core.engine.LoopProperties;
import com.mendloop.core.model.JobSpec;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.worker.WorkerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Fills in the parts of a {@link JobSpec} every phase shares: working directory, log path
 * keyed by (phase, task, iteration), label, model and extra context directories.
 * Computes paths only; nothing is created on disk.
 */
@Component
public class JobSpecFactory {

    private final ArtifactStore store;
    private final WorkerProperties workerProperties;
    private final Path workingDir;

    @Autowired
    public JobSpecFactory(ArtifactStore store, WorkerProperties workerProperties, LoopProperties loopProperties) {
        this(store, workerProperties, Path.of(loopProperties.getWorkingDir()));
    }

    public JobSpecFactory(ArtifactStore store, WorkerProperties workerProperties, Path workingDir) {
        this.store = store;
        this.workerProperties = workerProperties;
        this.workingDir = workingDir.toAbsolutePath().normalize();
    }

    public JobSpec create(LoopPhase phase, TaskDescriptor task, int iteration, String payload) {
        return create(phase, task, iteration, payload, store.logPath(phase, task.identity(), iteration));
    }

    /**
     * Spec for a job serving the whole queue; its log lives apart from every per-task log.
     */
    public JobSpec createShared(LoopPhase phase, TaskDescriptor job, int iteration, String payload) {
        return create(phase, job, iteration, payload, store.sharedLogPath(phase, job.identity(), iteration));
    }

    private JobSpec create(LoopPhase phase, TaskDescriptor task, int iteration, String payload, Path logPath) {
        var extraContext = new ArrayList<String>(workerProperties.getExtraContext());
        extraContext.add(store.root().toString());
        return new JobSpec(
                payload,
                workingDir.toString(),
                logPath.toString(),
                label(phase, task, iteration),
                extraContext,
                workerProperties.modelFor(phase.slug()),
                null);
    }

    public ArtifactStore store() {
        return store;
    }

    static String label(LoopPhase phase, TaskDescriptor task, int iteration) {
        return phase.slug() + ":" + task.identity() + "#" + iteration;
    }
}
