package com.casewright.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "casewright.llm")
public class LlmProperties {

    private String model = "qwen2.5:7b";
    private double temperature = 0.7;
    private Duration timeout = Duration.ofSeconds(600);
    private Integer maxTokens = 8000;
    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofMillis(500);

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public LlmOptions defaults() {
        return new LlmOptions(model, temperature, timeout, maxTokens);
    }

    /**
     * Options for one request, falling back to configured defaults for anything not overridden.
     */
    public LlmOptions resolve(String modelOverride, Double temperatureOverride) {
        String m = modelOverride != null && !modelOverride.isBlank() ? modelOverride.trim() : model;
        double t = temperatureOverride != null ? temperatureOverride : temperature;
        return new LlmOptions(m, t, timeout, maxTokens);
    }
}
