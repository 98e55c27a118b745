package com.plaetzchen.community.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * The compact constructors fill in defaults before Bean Validation runs, so a minimal YAML file is
 * enough to start the service.
 */
@DisplayName("Configuration defaults")
class PropertiesDefaultsTest {

    @Test
    @DisplayName("service properties default environment and CORS origin")
    void serviceProperties() {
        var props = new CommunityServiceProperties("community-service", null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.corsAllowedOrigins()).containsExactly("http://localhost:3000");
    }

    @Test
    @DisplayName("auth properties default issuer and token lifetimes")
    void authProperties() {
        var props = new AuthProperties("secret", null, null, null, null, null);

        assertThat(props.issuer()).isEqualTo("plaetzchen");
        assertThat(props.accessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.refreshTokenTtl()).isEqualTo(Duration.ofDays(30));
        assertThat(props.verificationTokenTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(props.passwordResetTokenTtl()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("event rules default deadline, delay and batch size")
    void eventRules() {
        var rules = EventRulesProperties.defaults();

        assertThat(rules.registrationDeadline()).isEqualTo(Duration.ofHours(24));
        assertThat(rules.autoAttendanceDelay()).isEqualTo(Duration.ofHours(1));
        assertThat(rules.completionBatchSize()).isEqualTo(10);
        assertThat(rules.schedulerEnabled()).isTrue();
    }

    @Test
    @DisplayName("moderation defaults to enabled with the standard thresholds")
    void moderation() {
        var moderation = ModerationProperties.defaults();

        assertThat(moderation.enabled()).isTrue();
        assertThat(moderation.flagThreshold()).isEqualTo(0.7);
        assertThat(moderation.reviewThreshold()).isEqualTo(0.3);
        assertThat(moderation.maxContentLength()).isEqualTo(2000);
        assertThat(moderation.bannedWords()).isNotEmpty();
    }

    @Test
    @DisplayName("configured origins are copied, not shared")
    void originsCopied() {
        var origins = new ArrayList<>(List.of("https://plaetzchen.example"));
        var props = new CommunityServiceProperties("svc", "prod", null, origins);
        origins.clear();

        assertThat(props.corsAllowedOrigins()).containsExactly("https://plaetzchen.example");
    }
}
