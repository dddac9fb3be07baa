package com.mendloop.worker;

import com.mendloop.core.model.JobSpec;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;

/**
 * Pure function building the job for one task in one phase. Implementations must not
 * have side effects, so phases can be exercised without launching anything.
 */
@FunctionalInterface
public interface JobSpecBuilder {

    JobSpec build(TaskDescriptor task, PhaseContext context);
}
