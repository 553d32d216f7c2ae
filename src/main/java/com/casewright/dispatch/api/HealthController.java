package com.casewright.dispatch.api;

import com.casewright.core.health.HealthCheckService;
import com.casewright.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean anyDown = false;
        boolean anyDegraded = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);
        return anyDown ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }
}
