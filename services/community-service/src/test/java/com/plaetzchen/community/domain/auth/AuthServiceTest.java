package com.plaetzchen.community.domain.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.plaetzchen.community.config.AuthProperties;
import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.security.AuthenticationRequiredException;
import com.plaetzchen.security.JwtTokenService;
import com.plaetzchen.security.OpaqueTokens;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService")
class AuthServiceTest {

    private static final long MEMBER = 7L;
    private static final Instant NOW = Instant.parse("2024-12-01T10:00:00Z");
    private static final String SECRET = "plaetzchen-unit-test-secret-0123456789";

    @Mock private UserRepository users;
    @Mock private RefreshTokenRepository refreshTokens;
    @Mock private EmailVerificationTokenRepository verificationTokens;
    @Mock private PasswordResetTokenRepository resetTokens;
    @Mock private PasswordEncoder passwordEncoder;
    @Mock private AccountMailer mailer;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        authService =
                new AuthService(
                        users,
                        refreshTokens,
                        verificationTokens,
                        resetTokens,
                        new JwtTokenService(SECRET, "plaetzchen", Duration.ofMinutes(30), clock),
                        passwordEncoder,
                        mailer,
                        new AuthProperties(SECRET, null, null, null, null, null),
                        new MetricFactory(new SimpleMeterRegistry(), "test"),
                        clock);
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        private static final String PRESENTED = "presented-refresh-token";

        @BeforeEach
        void storedToken() {
            RefreshToken stored =
                    new RefreshToken(
                            MEMBER, OpaqueTokens.hash(PRESENTED), NOW.minusSeconds(60), NOW.plus(Duration.ofDays(1)));
            when(refreshTokens.findByTokenHash(OpaqueTokens.hash(PRESENTED))).thenReturn(Optional.of(stored));
        }

        private User activeMember() {
            User user = mock(User.class);
            when(user.isActive()).thenReturn(true);
            when(users.findById(MEMBER)).thenReturn(Optional.of(user));
            return user;
        }

        @Test
        @DisplayName("issues a new pair once the presented token is revoked")
        void rotates() {
            User user = activeMember();
            when(user.getId()).thenReturn(MEMBER);
            when(refreshTokens.revokeIfActive(any(), any())).thenReturn(1);

            TokenResponse response = authService.refresh(new RefreshRequest(PRESENTED));

            assertThat(response.refreshToken()).isNotBlank().isNotEqualTo(PRESENTED);
            assertThat(response.expiresIn()).isEqualTo(1800);
            verify(refreshTokens).save(any(RefreshToken.class));
        }

        @Test
        @DisplayName("refuses when a concurrent rotation revoked the token first")
        void lostRace() {
            activeMember();
            when(refreshTokens.revokeIfActive(any(), any())).thenReturn(0);

            assertThatThrownBy(() -> authService.refresh(new RefreshRequest(PRESENTED)))
                    .isInstanceOf(AuthenticationRequiredException.class)
                    .hasMessage("Invalid refresh token");
            verify(refreshTokens, never()).save(any(RefreshToken.class));
        }
    }
}
