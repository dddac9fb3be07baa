package com.mendloop.core.metrics;

import com.mendloop.core.model.JobOutcome;
import com.mendloop.core.model.ValidationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for loop execution.
 */
@Service
public class MendloopMetrics {

    private final MeterRegistry registry;

    public MendloopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJob(String phase, JobOutcome outcome, Duration duration) {
        Timer.builder("mendloop.job.duration")
                .tag("phase", phase)
                .tag("outcome", outcome.name())
                .register(registry)
                .record(duration);
    }

    public void recordTimeout(String phase) {
        Counter.builder("mendloop.job.timeouts")
                .description("Worker processes killed at their deadline")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("mendloop.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordValidation(ValidationResult result) {
        Counter.builder("mendloop.validation.evaluations")
                .tag("result", result.converged() ? "passed" : "failed")
                .register(registry)
                .increment();

        DistributionSummary.builder("mendloop.validation.failed_items")
                .description("Failed validation items per iteration")
                .register(registry)
                .record(result.failed());
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("mendloop.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordRunResult(String status) {
        Counter.builder("mendloop.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
