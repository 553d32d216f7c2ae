package com.casewright.dispatch.api;

import com.casewright.core.events.CasewrightEvent;
import com.casewright.core.events.EventBus;
import com.casewright.core.model.Task;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Streams the events of one task to a client over SSE.
 * <p>
 * A stream starts with a {@code task.snapshot} event holding the task's current status and
 * progress, so a client that connects late still sees where the task stands. It ends after the
 * task's terminal event, or immediately after the snapshot when the task has already finished.
 * Open streams get a keepalive comment at a fixed interval because a single LLM call can leave
 * a task silent for minutes.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long DEFAULT_KEEPALIVE_MS = 30_000L;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final long keepaliveMs;

    private final Map<String, Set<TaskStream>> streams = new ConcurrentHashMap<>();

    private final ScheduledExecutorService keepalive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS, DEFAULT_KEEPALIVE_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs, long keepaliveMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        this.keepaliveMs = keepaliveMs;
    }

    @PostConstruct
    void start() {
        if (keepaliveMs > 0) {
            keepalive.scheduleWithFixedDelay(this::pingAll, keepaliveMs, keepaliveMs, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    void stop() {
        keepalive.shutdownNow();
        streams.values().forEach(open -> open.forEach(TaskStream::close));
    }

    /**
     * Opens a stream for {@code taskId}. The subscription is made before the snapshot is read,
     * so a task finishing in between still closes the stream.
     *
     * @param lookup current snapshot of the task; its exceptions propagate after the
     *               subscription is released
     */
    public SseEmitter open(String taskId, Function<String, Task> lookup) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        TaskStream stream = new TaskStream(taskId, emitter);
        streams.computeIfAbsent(taskId, k -> ConcurrentHashMap.newKeySet()).add(stream);
        stream.subscription = eventBus.subscribe(taskId, stream::forward);

        emitter.onCompletion(stream::close);
        emitter.onTimeout(() -> {
            log.debug("SSE stream for task {} timed out", taskId);
            stream.close();
        });
        emitter.onError(ex -> {
            log.debug("SSE stream for task {} failed: {}", taskId, ex.getMessage());
            stream.close();
        });

        Task task;
        try {
            task = lookup.apply(taskId);
        } catch (RuntimeException e) {
            stream.close();
            throw e;
        }
        stream.send("task.snapshot", snapshot(task));
        if (task.status().isTerminal()) {
            stream.close();
        } else {
            log.info("SSE stream opened for task {} ({})", taskId, task.status().wireName());
        }
        return emitter;
    }

    public int openStreamCount() {
        return streams.values().stream().mapToInt(Set::size).sum();
    }

    public int openStreamCount(String taskId) {
        Set<TaskStream> open = streams.get(taskId);
        return open == null ? 0 : open.size();
    }

    void pingAll() {
        streams.values().forEach(open -> open.forEach(TaskStream::ping));
    }

    private static Map<String, Object> snapshot(Task task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.id());
        data.put("task_type", task.kind().wireName());
        data.put("status", task.status().wireName());
        data.put("progress", task.progress());
        if (task.error() != null) {
            data.put("error", task.error());
        }
        return data;
    }

    private void detach(TaskStream stream) {
        streams.computeIfPresent(stream.taskId, (k, open) -> {
            open.remove(stream);
            return open.isEmpty() ? null : open;
        });
    }

    /** One client connection; closes at most once. */
    private final class TaskStream {
        private final String taskId;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile EventBus.Subscription subscription;

        private TaskStream(String taskId, SseEmitter emitter) {
            this.taskId = taskId;
            this.emitter = emitter;
        }

        void forward(CasewrightEvent event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("task_id", event.taskId());
            if (event.functionPointId() != null) {
                data.put("function_point_id", event.functionPointId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            send(event.eventType(), data);
            if (event.isTerminal()) {
                close();
            }
        }

        void send(String name, Object data) {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().name(name).data(data));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE stream for task {} after failed {}: {}", taskId, name, e.getMessage());
                close();
            }
        }

        void ping() {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().comment("keepalive"));
            } catch (IOException | IllegalStateException e) {
                close();
            }
        }

        void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            EventBus.Subscription s = subscription;
            if (s != null) {
                s.unsubscribe();
            }
            detach(this);
            emitter.complete();
        }
    }
}
