package com.switchboard.dispatch.api;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.http.HttpStatus;
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
     * GET /api/v1/health. The overall status is the worst component status; only DOWN gives 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        HealthStatus.Status overall = HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            Map<String, Object> component = new LinkedHashMap<>();
            component.put("status", check.status().name());
            component.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                component.put("metadata", check.metadata());
            }
            components.put(check.component(), component);
            overall = worse(overall, check.status());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);
        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body)
                : ResponseEntity.ok(body);
    }

    private static HealthStatus.Status worse(HealthStatus.Status a, HealthStatus.Status b) {
        if (a == HealthStatus.Status.DOWN || b == HealthStatus.Status.DOWN) {
            return HealthStatus.Status.DOWN;
        }
        if (a == HealthStatus.Status.DEGRADED || b == HealthStatus.Status.DEGRADED) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }
}
