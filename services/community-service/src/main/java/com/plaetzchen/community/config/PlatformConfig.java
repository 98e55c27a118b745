package com.plaetzchen.community.config;

import com.plaetzchen.database.migration.MigrationService;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.observability.SpanHelper;
import com.plaetzchen.security.JwtTokenService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.flywaydb.core.Flyway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the platform libraries (security, observability, database) into the Spring context.
 *
 * <p>WHY here: the libraries are plain Java with no Spring annotations, so this service decides how
 * they are configured. Tests replace the {@link Clock} bean to move time around.
 */
@Configuration
@EnableConfigurationProperties({
    CommunityServiceProperties.class,
    AuthProperties.class,
    EventRulesProperties.class,
    ModerationProperties.class
})
public class PlatformConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public JwtTokenService jwtTokenService(AuthProperties auth, Clock clock) {
        return new JwtTokenService(auth.jwtSecret(), auth.issuer(), auth.accessTokenTtl(), clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, CommunityServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    /** Uses the global OpenTelemetry instance, which stays a no-op unless an agent or SDK installs one. */
    @Bean
    public SpanHelper spanHelper(CommunityServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public MigrationService migrationService(Flyway flyway) {
        return new MigrationService(flyway, "community");
    }
}
