package com.casewright.core.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts finished tasks older than {@code casewright.tasks.retention}.
 * Does nothing when retention is zero (the default).
 */
@Component
public class TaskRetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(TaskRetentionSweeper.class);

    private final TaskRegistry registry;
    private final TaskProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "task-retention-sweeper");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public TaskRetentionSweeper(TaskRegistry registry, TaskProperties properties) {
        this(registry, properties, Clock.systemUTC());
    }

    TaskRetentionSweeper(TaskRegistry registry, TaskProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        if (!properties.isRetentionEnabled()) {
            log.debug("Task retention disabled; finished tasks are kept until shutdown");
            return;
        }
        long intervalMs = Math.max(properties.getSweepInterval().toMillis(), 1000L);
        scheduler.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Task retention sweeper started (retention={}, interval={}ms)",
                properties.getRetention(), intervalMs);
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
    }

    /**
     * Removes finished tasks older than the retention window.
     *
     * @return number of tasks evicted
     */
    public int sweep() {
        if (!properties.isRetentionEnabled()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(properties.getRetention());
        try {
            int removed = registry.evictFinishedBefore(cutoff);
            if (removed > 0) {
                log.info("Evicted {} finished task(s) older than {}", removed, properties.getRetention());
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Task retention sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }
}
