package com.mendloop.worker;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WorkerConfig {

    @Bean
    public WorkerLauncher workerLauncher(WorkerProperties properties) {
        return new LocalProcessLauncher(properties);
    }

    /**
     * The pool is aborted when the context closes, so a shutdown never leaves workers behind.
     */
    @Bean(destroyMethod = "abort")
    public WorkerPool workerPool(WorkerLauncher launcher, WorkerProperties properties) {
        return new WorkerPool(launcher,
                properties.getMaxParallel(),
                Duration.ofMillis(properties.getPollIntervalMs()),
                Duration.ofSeconds(properties.getTimeoutSeconds()));
    }
}
