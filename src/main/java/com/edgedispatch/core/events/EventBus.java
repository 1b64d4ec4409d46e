package com.edgedispatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for execution lifecycle events, keyed by execution id.
 * <p>
 * {@link ExecutionEvent#COMPLETED} is the last event an execution emits: once it has been
 * delivered, that execution's subscribers are released, so a waiter that never
 * unsubscribes does not pin its consumer for the life of the process.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ExecutionEvent>>> subscribers =
            new ConcurrentHashMap<>();

    public void publish(ExecutionEvent event) {
        log.debug("Publishing event: {} for execution {}", event.eventType(), event.executionId());

        List<Consumer<ExecutionEvent>> subs = ExecutionEvent.COMPLETED.equals(event.eventType())
                ? subscribers.remove(event.executionId())
                : subscribers.get(event.executionId());
        if (subs == null) {
            return;
        }
        for (Consumer<ExecutionEvent> subscriber : subs) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one execution.
     *
     * @return a {@link Subscription} handle to unsubscribe before completion
     */
    public Subscription subscribe(String executionId, Consumer<ExecutionEvent> consumer) {
        subscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to execution {}", executionId);
        return () -> subscribers.computeIfPresent(executionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ExecutionEvent> subscriber, ExecutionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber for execution {} failed on {}: {}",
                    event.executionId(), event.eventType(), e.getMessage(), e);
        }
    }
}
