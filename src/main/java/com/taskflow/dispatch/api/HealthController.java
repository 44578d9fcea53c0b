package com.taskflow.dispatch.api;

import com.taskflow.core.health.HealthCheckService;
import com.taskflow.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
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

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        Map<String, Object> components = new LinkedHashMap<>();
        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
        }

        var overall = HealthStatus.overall(checks);
        boolean anyDown = overall == HealthStatus.Status.DOWN;
        result.put("status", overall.name());
        result.put("components", components);
        return anyDown ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }
}
