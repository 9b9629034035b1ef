package com.habitrack.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;
    private EnvironmentValidator validator;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        environment.setConversionService(new ApplicationConversionService());
        environment.setProperty("habitrack.onboard.secret", "test-onboard-secret-with-at-least-32-bytes-of-entropy");
        validator = new EnvironmentValidator(environment);
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void kioskTtlMustBeShorterThanRegularTtl() {
        environment.setProperty("habitrack.session.ttl", "4h");
        environment.setProperty("habitrack.session.kiosk-ttl", "PT4H");

        assertThat(validator.collectProblems())
                .containsExactly("habitrack.session.kiosk-ttl must be shorter than habitrack.session.ttl");
    }

    @Test
    void unparsableDurationAndZeroThresholdAreReported() {
        environment.setProperty("habitrack.auth.lockout.window", "fifteen minutes");
        environment.setProperty("habitrack.auth.lockout.threshold", "0");

        assertThat(validator.collectProblems()).containsExactlyInAnyOrder(
                "habitrack.auth.lockout.threshold must be at least 1",
                "habitrack.auth.lockout.window must be a positive duration");
    }

    @Test
    void developmentSecretIsRejectedInProduction() {
        environment.setProperty("habitrack.onboard.secret", EnvironmentValidator.DEFAULT_ONBOARD_SECRET);
        assertThat(validator.collectProblems()).isEmpty();

        environment.setActiveProfiles("prod");

        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }
}
