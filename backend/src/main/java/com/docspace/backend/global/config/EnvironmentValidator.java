package com.docspace.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.docspace.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or still carries a development default.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_ACCESS_SECRET = "dev-access-secret-change-me-0123456789abcdef";
    static final String DEV_REFRESH_SECRET = "dev-refresh-secret-change-me-0123456789abcdef";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.refresh-secret",
            "jwt.expiration",
            "jwt.refresh-expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Invalid environment: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + " is required");
            }
        }

        boolean production = environment.acceptsProfiles(Profiles.of("prod"));
        Optional<String> accessSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        Optional<String> refreshSecret = Optional.ofNullable(environment.getProperty("jwt.refresh-secret"));

        if (production && accessSecret.filter(DEV_ACCESS_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still uses the development default");
        }
        if (production && refreshSecret.filter(DEV_REFRESH_SECRET::equals).isPresent()) {
            problems.add("jwt.refresh-secret still uses the development default");
        }
        if (accessSecret.isPresent() && refreshSecret.isPresent()
                && Objects.equals(accessSecret.get(), refreshSecret.get())) {
            problems.add("jwt.secret and jwt.refresh-secret must differ");
        }
        accessSecret.filter(EnvironmentValidator::isWeakKey)
                .ifPresent(secret -> problems.add("jwt.secret must yield a key of at least 32 bytes"));
        refreshSecret.filter(EnvironmentValidator::isWeakKey)
                .ifPresent(secret -> problems.add("jwt.refresh-secret must yield a key of at least 32 bytes"));

        String accessTtl = environment.getProperty("jwt.expiration");
        if (accessTtl != null) {
            try {
                long millis = Long.parseLong(accessTtl.trim());
                if (millis < 60_000L || millis > 86_400_000L) {
                    problems.add("jwt.expiration must be between 60000 and 86400000 ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        }
        return problems;
    }

    private static boolean isWeakKey(String secret) {
        return JwtTokenProvider.keyBytes(secret).length < JwtTokenProvider.MIN_KEY_BYTES;
    }
}
