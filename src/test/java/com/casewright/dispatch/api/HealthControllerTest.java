package com.casewright.dispatch.api;

import com.casewright.core.health.HealthCheckService;
import com.casewright.core.health.HealthStatus;
import com.casewright.core.llm.LlmProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({HealthController.class, ModelController.class})
@Import(LlmProperties.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health is 200 UP when every component is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("task-registry", HealthStatus.Status.UP, "ok", Map.of("pending", "0")),
                new HealthStatus("llm", HealthStatus.Status.UP, "ok", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components['task-registry'].metadata.pending").value("0"));
    }

    @Test
    @DisplayName("GET /health is 200 DEGRADED when a component is degraded")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("llm", HealthStatus.Status.DEGRADED, "no model", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("GET /health is 503 when a component is down")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("llm", HealthStatus.Status.DOWN, "No LLM base URL configured", Map.of()),
                new HealthStatus("task-executor", HealthStatus.Status.UP, "ok", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    @DisplayName("GET /models lists presets and the configured default")
    void models() throws Exception {
        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.default_model").value("qwen2.5:7b"))
                .andExpect(jsonPath("$.default_temperature").value(0.7))
                .andExpect(jsonPath("$.models", hasSize(greaterThanOrEqualTo(1))))
                .andExpect(jsonPath("$.models[0].context_window").exists());
    }
}
