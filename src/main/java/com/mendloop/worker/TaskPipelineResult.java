package com.mendloop.worker;

import com.mendloop.core.model.JobResult;
import com.mendloop.core.model.TaskDescriptor;

import java.util.List;

/**
 * Results of every pipeline stage for one task, in stage order.
 */
public record TaskPipelineResult(int queueIndex, TaskDescriptor task, List<JobResult> stageResults) {

    public JobResult stage(int index) {
        return stageResults.get(index);
    }
}
