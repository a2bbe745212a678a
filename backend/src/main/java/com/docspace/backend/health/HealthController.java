package com.docspace.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness at {@code /health}; readiness at {@code /readyz} reports the database and Redis checks
 * of the actuator health endpoint.
 */
@RestController
public class HealthController {

    private static final String STATUS_DOWN = "DOWN";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent overall = healthEndpoint.health();
        String status = overall.getStatus().getCode();
        if (overall instanceof CompositeHealth composite) {
            for (String component : new String[] {"db", "redis"}) {
                HealthComponent detail = composite.getComponents().get(component);
                if (detail != null && STATUS_DOWN.equals(detail.getStatus().getCode())) {
                    status = STATUS_DOWN;
                }
            }
        }
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
