package com.mendloop.worker;

import com.mendloop.core.model.JobResult;

/**
 * Callbacks from the pool's controlling thread as jobs start and finish.
 */
public interface JobListener {

    JobListener NONE = new JobListener() {};

    default void jobStarted(JobHandle handle) {
    }

    /**
     * @param stage name of the pipeline stage the result belongs to
     */
    default void jobCompleted(JobResult result, String stage) {
    }
}
