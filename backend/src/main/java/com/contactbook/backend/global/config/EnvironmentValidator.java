package com.contactbook.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-to-a-random-secret-of-at-least-32-bytes";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.data.redis.host",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration",
            "contactbook.public-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(PLACEHOLDER_SECRET::equals)
                .ifPresent(secret -> problems.add("jwt.secret: replace the placeholder with a random secret"));

        checkRange(problems, "jwt.expiration", 60_000L, 86_400_000L);
        checkRange(problems, "jwt.refresh-expiration", 3_600_000L, 90L * 86_400_000L);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    private void checkRange(List<String> problems, String property, long min, long max) {
        String raw = environment.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                problems.add(property + ": must be between " + min + " and " + max + " milliseconds");
            }
        } catch (NumberFormatException e) {
            problems.add(property + ": must be a number of milliseconds");
        }
    }
}
