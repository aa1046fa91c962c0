package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.health.HealthCheckService;
import com.groupdispatch.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for dispatch health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 when no component is DOWN, 503 otherwise.
     * A DEGRADED component (e.g. during shutdown) makes the overall status DEGRADED.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = overall(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", overall.name());
        result.put("components", components);
        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(503).body(result)
                : ResponseEntity.ok(result);
    }

    static HealthStatus.Status overall(List<HealthStatus> checks) {
        HealthStatus.Status overall = HealthStatus.Status.UP;
        for (HealthStatus check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (check.status() == HealthStatus.Status.DEGRADED) {
                overall = HealthStatus.Status.DEGRADED;
            }
        }
        return overall;
    }
}
