package com.melo.backend.global.config;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Fails start-up when a required key is missing or malformed.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final String PLACEHOLDER_SECRET = "dev-jwt-secret-change-me";

    private static final String[] REQUIRED_KEYS = {
            "app.protocol.homeserver-url",
            "app.protocol.access-token",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(PLACEHOLDER_SECRET::equals)
                .ifPresent(secret -> invalid.add("jwt.secret: replace the placeholder with a random value"));

        Optional.ofNullable(environment.getProperty("app.protocol.homeserver-url"))
                .filter(url -> !url.isBlank())
                .ifPresent(url -> {
                    try {
                        URI uri = URI.create(url);
                        if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                            invalid.add("app.protocol.homeserver-url: must be an http(s) URL");
                        }
                    } catch (IllegalArgumentException ex) {
                        invalid.add("app.protocol.homeserver-url: " + ex.getMessage());
                    }
                });

        for (String key : List.of("app.moderation.sweep-interval", "app.moderation.max-ban-duration", "app.protocol.request-timeout")) {
            String value = environment.getProperty(key);
            if (value == null) {
                continue;
            }
            try {
                if (Duration.parse(value).isNegative()) {
                    invalid.add(key + ": must not be negative");
                }
            } catch (DateTimeParseException ex) {
                invalid.add(key + ": must be an ISO-8601 duration such as PT30S");
            }
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required configuration: {}", String.join(", ", missing));
            }
            invalid.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed; missing=" + missing + ", invalid=" + invalid);
        }

        log.info("Environment validation passed");
    }
}
