package com.mingle.backend.global.config;

import java.nio.charset.StandardCharsets;
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
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-mingle-jwt-secret-for-local-development-only";
    private static final long MIN_TOKEN_TTL_MILLIS = 300_000L;
    private static final long MAX_TOKEN_TTL_MILLIS = 86_400_000L;
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is required");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean placeholderAllowed = environment.getProperty("mingle.allow-placeholder-secret", Boolean.class, false);
        if (!placeholderAllowed && jwtSecret.filter(PLACEHOLDER_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the placeholder with a random value");
        }
        jwtSecret.filter(secret -> !secret.isBlank())
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes"));

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent() && !jwtExpiration.get().isBlank()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < MIN_TOKEN_TTL_MILLIS || expiration > MAX_TOKEN_TTL_MILLIS) {
                    problems.add("jwt.expiration: must be between "
                            + MIN_TOKEN_TTL_MILLIS + " and " + MAX_TOKEN_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        }
        return problems;
    }
}
