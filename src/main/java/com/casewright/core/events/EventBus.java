package com.casewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers task events to the subscribers of that task and to global subscribers.
 * <p>
 * A task's subscriptions end with its terminal event: the subscriber list is dropped
 * before that event is delivered, so listeners of finished tasks never accumulate.
 * A subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<CasewrightEvent>>> byTask = new ConcurrentHashMap<>();

    private final List<Consumer<CasewrightEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(CasewrightEvent event) {
        List<Consumer<CasewrightEvent>> listeners = event.isTerminal()
                ? byTask.remove(event.taskId())
                : byTask.get(event.taskId());

        int delivered = 0;
        if (listeners != null) {
            for (Consumer<CasewrightEvent> listener : listeners) {
                delivered += deliver(listener, event);
            }
        }
        for (Consumer<CasewrightEvent> listener : global) {
            delivered += deliver(listener, event);
        }
        log.debug("{} for task {} delivered to {} subscriber(s)", event.eventType(), event.taskId(), delivered);
    }

    /**
     * Listens to one task until its terminal event or until the returned handle is used.
     */
    public Subscription subscribe(String taskId, Consumer<CasewrightEvent> listener) {
        byTask.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byTask.computeIfPresent(taskId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Listens to every task for the life of the bus unless unsubscribed. */
    public Subscription subscribeAll(Consumer<CasewrightEvent> listener) {
        global.add(listener);
        return () -> global.remove(listener);
    }

    public int subscriberCount(String taskId) {
        List<Consumer<CasewrightEvent>> listeners = byTask.get(taskId);
        return listeners == null ? 0 : listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static int deliver(Consumer<CasewrightEvent> listener, CasewrightEvent event) {
        try {
            listener.accept(event);
            return 1;
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
            return 0;
        }
    }
}
