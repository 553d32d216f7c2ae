package com.casewright.core.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "casewright.tasks")
public class TaskProperties {

    /** Threads running whole tasks (one task occupies one thread for its lifetime). */
    private int executorThreads = 4;

    /** How long finished tasks are kept. Zero keeps them for the life of the process. */
    private Duration retention = Duration.ZERO;

    private Duration sweepInterval = Duration.ofMinutes(10);

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public boolean isRetentionEnabled() {
        return retention != null && !retention.isZero() && !retention.isNegative();
    }
}
