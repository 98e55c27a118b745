package com.plaetzchen.community.domain.auth;

import com.plaetzchen.community.config.AuthProperties;
import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.ConflictException;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserPrivateView;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.security.AccessDeniedException;
import com.plaetzchen.security.AuthenticationRequiredException;
import com.plaetzchen.security.IssuedAccessToken;
import com.plaetzchen.security.JwtTokenService;
import com.plaetzchen.security.OpaqueTokens;
import com.plaetzchen.security.PasswordPolicy;
import com.plaetzchen.security.PlatformSecurityContext;
import com.plaetzchen.security.SecurityValidationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registration, login and the token lifecycle around an account.
 *
 * <p>Access tokens are stateless JWTs. Refresh, verification and reset tokens are opaque random
 * strings handed to the client once; the database keeps only their SHA-256 hashes.
 *
 * <p>WHY: storing hashes means a leaked table cannot be replayed against the API.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String METRIC_LOGINS = "community.auth.logins";
    static final String METRIC_REGISTERED = "community.users.registered";

    static final String BAD_CREDENTIALS = "Incorrect email or password";
    static final String INVALID_REFRESH_TOKEN = "Invalid refresh token";
    static final String FORGOT_PASSWORD_MESSAGE =
            "If an account with that email exists, a password reset link has been sent";

    private final UserRepository users;
    private final RefreshTokenRepository refreshTokens;
    private final EmailVerificationTokenRepository verificationTokens;
    private final PasswordResetTokenRepository resetTokens;
    private final JwtTokenService jwtTokenService;
    private final PasswordEncoder passwordEncoder;
    private final AccountMailer mailer;
    private final AuthProperties properties;
    private final MetricFactory metrics;
    private final Clock clock;

    public AuthService(
            UserRepository users,
            RefreshTokenRepository refreshTokens,
            EmailVerificationTokenRepository verificationTokens,
            PasswordResetTokenRepository resetTokens,
            JwtTokenService jwtTokenService,
            PasswordEncoder passwordEncoder,
            AccountMailer mailer,
            AuthProperties properties,
            MetricFactory metrics,
            Clock clock) {
        this.users = users;
        this.refreshTokens = refreshTokens;
        this.verificationTokens = verificationTokens;
        this.resetTokens = resetTokens;
        this.jwtTokenService = jwtTokenService;
        this.passwordEncoder = passwordEncoder;
        this.mailer = mailer;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Account ──

    @Transactional
    public UserPrivateView register(RegisterRequest request) {
        checkPasswordPolicy(request.password());
        String email = normalize(request.email());
        String displayName = request.displayName().trim();
        if (users.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }
        if (users.existsByDisplayName(displayName)) {
            throw new ConflictException("Display name already taken");
        }

        User user =
                new User(displayName, email, passwordEncoder.encode(request.password()), Instant.now(clock));
        user.setFirstName(request.firstName());
        user.setLastName(request.lastName());
        user.setBio(request.bio());
        user.setLocation(request.location());
        user = users.save(user);

        issueVerificationToken(user);
        metrics.increment(METRIC_REGISTERED, "Accounts registered");
        log.info("Registered user {}", user.getId());
        return UserPrivateView.of(user);
    }

    @Transactional(readOnly = true)
    public UserPrivateView me(PlatformSecurityContext ctx) {
        return UserPrivateView.of(user(ctx.userId()));
    }

    public AuthStatusView status(PlatformSecurityContext ctx) {
        if (ctx == null) {
            return AuthStatusView.anonymous();
        }
        return users.findById(ctx.userId())
                .map(u -> new AuthStatusView(true, u.getId(), u.isEmailVerified()))
                .orElseGet(AuthStatusView::anonymous);
    }

    /** Changes the address after re-checking the password. The new address starts unverified. */
    @Transactional
    public UserPrivateView changeEmail(PlatformSecurityContext ctx, ChangeEmailRequest request) {
        User user = user(ctx.userId());
        requirePassword(user, request.password());
        String email = normalize(request.newEmail());
        if (!email.equals(user.getEmail()) && users.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }
        user.changeEmail(email);
        issueVerificationToken(user);
        log.info("User {} changed their email address", user.getId());
        return UserPrivateView.of(user);
    }

    @Transactional
    public void deleteAccount(PlatformSecurityContext ctx, PasswordConfirmation request) {
        User user = user(ctx.userId());
        requirePassword(user, request.password());
        int revoked = refreshTokens.revokeAllForUser(user.getId(), Instant.now(clock));
        user = user(ctx.userId());
        user.deactivateAccount();
        log.info("User {} deactivated their account ({} refresh tokens revoked)", user.getId(), revoked);
    }

    // ── Sessions ──

    @Transactional
    public TokenResponse login(LoginRequest request) {
        User user = users.findByEmail(normalize(request.email())).orElse(null);
        if (user == null || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            metrics.increment(METRIC_LOGINS, "Login attempts", "outcome", "failure");
            log.info("Failed login attempt");
            throw new AuthenticationRequiredException(BAD_CREDENTIALS);
        }
        if (!user.isActive()) {
            metrics.increment(METRIC_LOGINS, "Login attempts", "outcome", "inactive");
            throw new AccessDeniedException("Account is deactivated");
        }
        metrics.increment(METRIC_LOGINS, "Login attempts", "outcome", "success");
        log.info("User {} logged in", user.getId());
        return issueTokens(user.getId());
    }

    /**
     * Rotates a refresh token: the presented token is revoked before the new pair is issued.
     * The revoke is a conditional update, so of two concurrent rotations only one wins.
     */
    @Transactional
    public TokenResponse refresh(RefreshRequest request) {
        Instant now = Instant.now(clock);
        RefreshToken token =
                refreshTokens.findByTokenHash(OpaqueTokens.hash(request.refreshToken()))
                        .filter(t -> t.isUsable(now))
                        .orElseThrow(() -> new AuthenticationRequiredException(INVALID_REFRESH_TOKEN));
        User user =
                users.findById(token.getUserId())
                        .filter(User::isActive)
                        .orElseThrow(() -> new AuthenticationRequiredException(INVALID_REFRESH_TOKEN));
        if (refreshTokens.revokeIfActive(token.getId(), now) == 0) {
            log.warn("Refresh token {} was rotated concurrently", token.getId());
            throw new AuthenticationRequiredException(INVALID_REFRESH_TOKEN);
        }
        return issueTokens(user.getId());
    }

    /** Revokes one refresh token. Unknown or already revoked tokens are accepted silently. */
    @Transactional
    public void logout(RefreshRequest request) {
        Instant now = Instant.now(clock);
        refreshTokens.findByTokenHash(OpaqueTokens.hash(request.refreshToken())).ifPresent(t -> t.revoke(now));
    }

    @Transactional
    public int logoutAll(PlatformSecurityContext ctx) {
        int revoked = refreshTokens.revokeAllForUser(ctx.userId(), Instant.now(clock));
        log.info("User {} logged out everywhere ({} refresh tokens revoked)", ctx.userId(), revoked);
        return revoked;
    }

    // ── Email verification ──

    @Transactional
    public UserPrivateView verifyEmail(TokenRequest request) {
        Instant now = Instant.now(clock);
        EmailVerificationToken token =
                verificationTokens.findByTokenHash(OpaqueTokens.hash(request.token()))
                        .filter(t -> t.isUsable(now))
                        .orElseThrow(
                                () -> new BusinessRuleException("Invalid or expired verification token"));
        User user = user(token.getUserId());
        token.consume(now);
        user.markEmailVerified(now);
        log.info("User {} verified their email address", user.getId());
        return UserPrivateView.of(user);
    }

    @Transactional
    public void resendVerification(PlatformSecurityContext ctx) {
        User user = user(ctx.userId());
        if (user.isEmailVerified()) {
            throw new ConflictException("Email already verified");
        }
        issueVerificationToken(user);
    }

    // ── Password reset ──

    /**
     * Starts a reset when an active account owns the address. The caller sees the same outcome
     * either way.
     */
    @Transactional
    public String forgotPassword(ForgotPasswordRequest request) {
        users.findByEmail(normalize(request.email()))
                .filter(User::isActive)
                .ifPresent(
                        user -> {
                            Instant now = Instant.now(clock);
                            String token = OpaqueTokens.generate();
                            resetTokens.save(
                                    new PasswordResetToken(
                                            user.getId(),
                                            OpaqueTokens.hash(token),
                                            now,
                                            now.plus(properties.passwordResetTokenTtl())));
                            mailer.sendPasswordReset(user.getEmail(), token);
                        });
        return FORGOT_PASSWORD_MESSAGE;
    }

    @Transactional
    public void resetPassword(ResetPasswordRequest request) {
        Instant now = Instant.now(clock);
        PasswordResetToken token =
                resetTokens.findByTokenHash(OpaqueTokens.hash(request.token()))
                        .filter(t -> t.isUsable(now))
                        .orElseThrow(() -> new BusinessRuleException("Invalid or expired reset token"));
        checkPasswordPolicy(request.newPassword());
        token.consume(now);
        resetTokens.flush();
        int revoked = refreshTokens.revokeAllForUser(token.getUserId(), now);
        User user = user(token.getUserId());
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        log.info("User {} reset their password ({} refresh tokens revoked)", user.getId(), revoked);
    }

    // ── Maintenance ──

    @Transactional
    public TokenPurgeResult purgeExpiredTokens() {
        Instant now = Instant.now(clock);
        TokenPurgeResult result =
                new TokenPurgeResult(
                        refreshTokens.deleteExpired(now),
                        verificationTokens.deleteExpired(now),
                        resetTokens.deleteExpired(now));
        log.info("Purged {} expired tokens", result.total());
        return result;
    }

    // ── Helpers ──

    private TokenResponse issueTokens(long userId) {
        Instant now = Instant.now(clock);
        IssuedAccessToken access = jwtTokenService.issueAccessToken(userId);
        String refresh = OpaqueTokens.generate();
        refreshTokens.save(
                new RefreshToken(
                        userId, OpaqueTokens.hash(refresh), now, now.plus(properties.refreshTokenTtl())));
        return TokenResponse.bearer(access.token(), refresh, access.expiresIn());
    }

    /**
     * Issues a fresh verification token. Earlier tokens stop working because they may belong to an
     * old address.
     */
    private void issueVerificationToken(User user) {
        Instant now = Instant.now(clock);
        verificationTokens.consumeAllForUser(user.getId(), now);
        String token = OpaqueTokens.generate();
        verificationTokens.save(
                new EmailVerificationToken(
                        user.getId(),
                        OpaqueTokens.hash(token),
                        now,
                        now.plus(properties.verificationTokenTtl())));
        mailer.sendVerification(user.getEmail(), token);
    }

    private void requirePassword(User user, String password) {
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthenticationRequiredException("Incorrect password");
        }
    }

    private static void checkPasswordPolicy(String password) {
        SecurityValidationResult result = PasswordPolicy.validate(password);
        if (!result.valid()) {
            throw new BusinessRuleException(result.summary());
        }
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private User user(long userId) {
        return users.findById(userId).orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }
}
