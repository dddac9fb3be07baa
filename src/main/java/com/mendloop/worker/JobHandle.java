package com.mendloop.worker;

import com.mendloop.core.model.JobSpec;
import com.mendloop.core.model.TaskDescriptor;

import java.time.Instant;

/**
 * One worker invocation in flight. Owned by the {@link WorkerPool} from launch until its
 * result is collected.
 *
 * @param spec       the job that was launched
 * @param process    the running worker
 * @param startedAt  launch time
 * @param deadline   time after which the process is killed; {@code null} for no deadline
 * @param queueIndex position of {@link #task} in the original queue
 * @param task       the task served
 * @param stage      pipeline stage index (0 for single-stage runs)
 */
public record JobHandle(
    JobSpec spec,
    WorkerProcess process,
    Instant startedAt,
    Instant deadline,
    int queueIndex,
    TaskDescriptor task,
    int stage
) {

    public boolean expired(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
