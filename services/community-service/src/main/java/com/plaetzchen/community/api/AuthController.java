package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.auth.AuthService;
import com.plaetzchen.community.domain.auth.AuthStatusView;
import com.plaetzchen.community.domain.auth.ChangeEmailRequest;
import com.plaetzchen.community.domain.auth.ForgotPasswordRequest;
import com.plaetzchen.community.domain.auth.LoginRequest;
import com.plaetzchen.community.domain.auth.PasswordConfirmation;
import com.plaetzchen.community.domain.auth.RefreshRequest;
import com.plaetzchen.community.domain.auth.RegisterRequest;
import com.plaetzchen.community.domain.auth.ResetPasswordRequest;
import com.plaetzchen.community.domain.auth.TokenRequest;
import com.plaetzchen.community.domain.auth.TokenResponse;
import com.plaetzchen.community.domain.user.UserPrivateView;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account and session endpoints.
 *
 * <p>Login, refresh and the mailed-token flows are anonymous; everything touching an existing
 * account requires a bearer token.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserPrivateView register(@Valid @RequestBody RegisterRequest request) {
        return authService.register(request);
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request);
    }

    @PostMapping("/logout")
    public Map<String, Object> logout(@Valid @RequestBody RefreshRequest request) {
        authService.logout(request);
        return Map.of("message", "Logged out successfully");
    }

    @PostMapping("/logout-all")
    public Map<String, Object> logoutAll() {
        int revoked = authService.logoutAll(CurrentUserHolder.require());
        return Map.of("message", "Logged out from all devices", "revokedTokens", revoked);
    }

    @PostMapping("/verify-email")
    public UserPrivateView verifyEmail(@Valid @RequestBody TokenRequest request) {
        return authService.verifyEmail(request);
    }

    @PostMapping("/resend-verification")
    public Map<String, Object> resendVerification() {
        authService.resendVerification(CurrentUserHolder.require());
        return Map.of("message", "Verification email sent");
    }

    @PostMapping("/forgot-password")
    public Map<String, Object> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return Map.of("message", authService.forgotPassword(request));
    }

    @PostMapping("/reset-password")
    public Map<String, Object> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request);
        return Map.of("message", "Password has been reset");
    }

    @PutMapping("/email")
    public UserPrivateView changeEmail(@Valid @RequestBody ChangeEmailRequest request) {
        return authService.changeEmail(CurrentUserHolder.require(), request);
    }

    @DeleteMapping("/account")
    public Map<String, Object> deleteAccount(@Valid @RequestBody PasswordConfirmation request) {
        authService.deleteAccount(CurrentUserHolder.require(), request);
        return Map.of("message", "Account deactivated");
    }

    @GetMapping("/me")
    public UserPrivateView me() {
        return authService.me(CurrentUserHolder.require());
    }

    @GetMapping("/status")
    public AuthStatusView status() {
        return authService.status(CurrentUserHolder.get().orElse(null));
    }
}
