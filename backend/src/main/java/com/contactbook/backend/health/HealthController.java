package com.contactbook.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private static final String[] READINESS_COMPONENTS = {"db", "redis"};

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/api/healthchecker")
    public Map<String, String> healthChecker() {
        return Map.of("message", "Server alive.");
    }

    /**
     * Liveness only; does not touch the database or Redis.
     */
    @GetMapping({"/healthz", "/health"})
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    /**
     * Readiness: DOWN unless both the database and Redis report UP.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent health = healthEndpoint.health();
        String status = Status.UP.getCode();
        if (health instanceof CompositeHealth composite) {
            for (String component : READINESS_COMPONENTS) {
                HealthComponent detail = composite.getComponents().get(component);
                if (detail != null && !Status.UP.equals(detail.getStatus())) {
                    status = detail.getStatus().getCode();
                }
            }
        } else {
            status = health.getStatus().getCode();
        }
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
