package com.mendloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of {@link LoopEvent}s from the controlling thread to the CLI.
 * <p>
 * A subscriber either follows one run or every run. Delivery is synchronous and in
 * registration order; a subscriber that throws is logged and skipped so progress output
 * can never break a run.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(LoopEvent event) {
        log.debug("Event {} (run {}, task {})", event.eventType(), event.runId(), event.taskId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliver(registration.consumer(), event);
            }
        }
    }

    /**
     * Stamps and publishes an event; {@code taskId} is null for run- and phase-level events.
     */
    public void publish(String eventType, String runId, String taskId, Map<String, Object> payload) {
        publish(LoopEvent.of(eventType, runId, taskId, payload));
    }

    /** Receives only the events of {@code runId}. */
    public Subscription subscribe(String runId, Consumer<LoopEvent> consumer) {
        return register(new Registration(runId, consumer));
    }

    /** Receives the events of every run. */
    public Subscription subscribeAll(Consumer<LoopEvent> consumer) {
        return register(new Registration(null, consumer));
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliver(Consumer<LoopEvent> consumer, LoopEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /** Compared by identity. */
    private static final class Registration {

        private final String runId;
        private final Consumer<LoopEvent> consumer;

        Registration(String runId, Consumer<LoopEvent> consumer) {
            this.runId = runId;
            this.consumer = consumer;
        }

        boolean accepts(LoopEvent event) {
            return runId == null || runId.equals(event.runId());
        }

        Consumer<LoopEvent> consumer() {
            return consumer;
        }
    }
}
