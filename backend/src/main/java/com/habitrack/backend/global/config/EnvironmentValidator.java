package com.habitrack.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks the security-relevant settings once the context is up and refuses to run with unsafe ones.
 */
@Component
public class EnvironmentValidator {

    static final String DEFAULT_ONBOARD_SECRET = "dev-onboard-secret-change-me-in-production-0123456789";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid HabiTrack configuration: " + String.join("; ", problems));
        }
        log.info("HabiTrack configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        Duration ttl = duration("habitrack.session.ttl", Duration.ofDays(30));
        Duration kioskTtl = duration("habitrack.session.kiosk-ttl", Duration.ofHours(4));
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            problems.add("habitrack.session.ttl must be a positive duration");
        }
        if (kioskTtl == null || kioskTtl.isZero() || kioskTtl.isNegative()) {
            problems.add("habitrack.session.kiosk-ttl must be a positive duration");
        } else if (ttl != null && kioskTtl.compareTo(ttl) >= 0) {
            problems.add("habitrack.session.kiosk-ttl must be shorter than habitrack.session.ttl");
        }

        Integer threshold = environment.getProperty("habitrack.auth.lockout.threshold", Integer.class, 5);
        if (threshold == null || threshold < 1) {
            problems.add("habitrack.auth.lockout.threshold must be at least 1");
        }
        Duration window = duration("habitrack.auth.lockout.window", Duration.ofMinutes(15));
        if (window == null || window.isZero() || window.isNegative()) {
            problems.add("habitrack.auth.lockout.window must be a positive duration");
        }

        Optional<String> secret = Optional.ofNullable(environment.getProperty("habitrack.onboard.secret"));
        if (secret.map(String::trim).orElse("").isEmpty()) {
            problems.add("habitrack.onboard.secret is required");
        } else if (isProduction() && secret.get().equals(DEFAULT_ONBOARD_SECRET)) {
            problems.add("habitrack.onboard.secret still has its development default");
        }
        return problems;
    }

    private Duration duration(String key, Duration fallback) {
        try {
            return environment.getProperty(key, Duration.class, fallback);
        } catch (ConversionException ex) {
            return null;
        }
    }

    private boolean isProduction() {
        return Arrays.asList(environment.getActiveProfiles()).contains("prod");
    }
}
