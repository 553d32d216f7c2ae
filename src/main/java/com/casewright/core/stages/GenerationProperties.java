package com.casewright.core.stages;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "casewright.generation")
public class GenerationProperties {

    private int defaultMaxWorkers = 4;
    private int maxWorkersCap = 8;

    public int getDefaultMaxWorkers() {
        return defaultMaxWorkers;
    }

    public void setDefaultMaxWorkers(int defaultMaxWorkers) {
        this.defaultMaxWorkers = defaultMaxWorkers;
    }

    public int getMaxWorkersCap() {
        return maxWorkersCap;
    }

    public void setMaxWorkersCap(int maxWorkersCap) {
        this.maxWorkersCap = maxWorkersCap;
    }
}
