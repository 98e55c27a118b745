package com.plaetzchen.security;

import java.util.Set;

/**
 * Security context of one authenticated request.
 *
 * <p>WHY a record: immutable, it is the single source of truth for every authorization decision
 * taken while the request is served.
 *
 * @param user authenticated member
 * @param roles granted roles
 * @param token the bearer token the request presented
 * @param correlationId correlation ID of the request
 */
public record PlatformSecurityContext(
        AuthenticatedUser user, Set<Role> roles, String token, String correlationId) {

    public PlatformSecurityContext {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public long userId() {
        return user.userId();
    }

    public boolean isAdmin() {
        return RoleChecker.hasRole(this, Role.ADMIN);
    }
}
