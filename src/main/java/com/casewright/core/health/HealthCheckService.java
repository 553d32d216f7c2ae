package com.casewright.core.health;

import com.casewright.core.llm.LlmProperties;
import com.casewright.core.model.Task;
import com.casewright.core.model.TaskStatus;
import com.casewright.core.registry.TaskRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Reports the state of the components a request depends on. The LLM endpoint is not
 * called; only its configuration is checked.
 */
@Service
public class HealthCheckService {

    private final TaskRegistry registry;
    private final ExecutorService taskExecutionPool;
    private final LlmProperties llmProperties;
    private final String llmBaseUrl;

    public HealthCheckService(TaskRegistry registry,
                              @Qualifier("taskExecutionPool") ExecutorService taskExecutionPool,
                              LlmProperties llmProperties,
                              @Value("${spring.ai.openai.base-url:}") String llmBaseUrl) {
        this.registry = registry;
        this.taskExecutionPool = taskExecutionPool;
        this.llmProperties = llmProperties;
        this.llmBaseUrl = llmBaseUrl;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkExecutor());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkRegistry() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (Task task : registry.list()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            metadata.put(status.wireName(), String.valueOf(counts.getOrDefault(status, 0)));
        }
        return new HealthStatus("task-registry", HealthStatus.Status.UP,
                "In-memory registry tracking " + counts.values().stream().mapToInt(Integer::intValue).sum()
                        + " task(s)", metadata);
    }

    private HealthStatus checkExecutor() {
        if (taskExecutionPool.isShutdown()) {
            return new HealthStatus("task-executor", HealthStatus.Status.DOWN,
                    "Task executor is shut down", Map.of());
        }
        return new HealthStatus("task-executor", HealthStatus.Status.UP,
                "Task executor accepting work", Map.of());
    }

    private HealthStatus checkLlm() {
        if (llmBaseUrl == null || llmBaseUrl.isBlank()) {
            return new HealthStatus("llm", HealthStatus.Status.DOWN,
                    "No LLM base URL configured (spring.ai.openai.base-url)", Map.of());
        }
        if (llmProperties.getModel() == null || llmProperties.getModel().isBlank()) {
            return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                    "No default model configured; requests must name one", Map.of("base_url", llmBaseUrl));
        }
        return new HealthStatus("llm", HealthStatus.Status.UP,
                "Model " + llmProperties.getModel() + " at " + llmBaseUrl,
                Map.of("base_url", llmBaseUrl, "model", llmProperties.getModel()));
    }
}
