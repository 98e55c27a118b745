package com.plaetzchen.community.infrastructure.web;

import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.observability.CorrelationContextHolder;
import com.plaetzchen.security.AuthenticatedUser;
import com.plaetzchen.security.BearerTokenExtractor;
import com.plaetzchen.security.CurrentUserHolder;
import com.plaetzchen.security.JwtTokenService;
import com.plaetzchen.security.PlatformSecurityContext;
import com.plaetzchen.security.Role;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the bearer token of a request into a {@link PlatformSecurityContext}.
 *
 * <p>The filter never rejects a request. A missing, invalid or expired token, or a token of a
 * deactivated member, leaves the request anonymous; endpoints that need a member call {@link
 * CurrentUserHolder#require()} and answer 401 themselves.
 *
 * <p>Runs right after {@link CorrelationIdFilter} so the member id can be added to the MDC of the
 * existing correlation context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    private final JwtTokenService tokenService;
    private final UserRepository users;

    public AuthenticationFilter(JwtTokenService tokenService, UserRepository users) {
        this.tokenService = tokenService;
        this.users = users;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        resolve(request.getHeader(HttpHeaders.AUTHORIZATION))
                .ifPresent(
                        context -> {
                            CurrentUserHolder.set(context);
                            CorrelationContextHolder.get()
                                    .ifPresent(
                                            correlation ->
                                                    CorrelationContextHolder.set(
                                                            correlation.withUserId(
                                                                    String.valueOf(
                                                                            context.userId()))));
                        });

        try {
            filterChain.doFilter(request, response);
        } finally {
            CurrentUserHolder.clear();
        }
    }

    private Optional<PlatformSecurityContext> resolve(String authorizationHeader) {
        Optional<String> token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        Optional<Long> userId = tokenService.parseAccessToken(token.get());
        if (userId.isEmpty()) {
            log.debug("Ignoring invalid bearer token");
            return Optional.empty();
        }
        Optional<User> user = users.findById(userId.get()).filter(User::isActive);
        if (user.isEmpty()) {
            log.debug("Ignoring token of unknown or inactive user {}", userId.get());
            return Optional.empty();
        }
        User member = user.get();
        return Optional.of(
                new PlatformSecurityContext(
                        new AuthenticatedUser(
                                member.getId(), member.getEmail(), member.getDisplayName()),
                        Role.forMember(member.isAdmin()),
                        token.get(),
                        CorrelationContextHolder.currentCorrelationId()));
    }
}
