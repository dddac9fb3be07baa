package com.mendloop.worker;

/**
 * One stage of a per-task pipeline. Stages run in order for each task; different
 * tasks progress independently.
 *
 * @param name    stage name used in logs (usually the phase slug)
 * @param builder job spec builder for the stage
 */
public record PipelineStage(String name, JobSpecBuilder builder) {}
