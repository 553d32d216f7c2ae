package com.casewright.core.engine;

import com.casewright.core.registry.TaskProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TaskExecutionConfig {

    /** Runs whole tasks in the background; one task holds one thread until it finishes. */
    @Bean(name = "taskExecutionPool", destroyMethod = "shutdownNow")
    public ExecutorService taskExecutionPool(TaskProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutorThreads()), r -> {
            Thread t = new Thread(r, "casewright-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
