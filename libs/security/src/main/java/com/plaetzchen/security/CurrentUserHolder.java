package com.plaetzchen.security;

import java.util.Optional;

/**
 * Thread-local holder for the {@link PlatformSecurityContext} of the request being served.
 * <p>
 * The authentication filter sets it after validating the bearer token and clears it when the
 * request completes. Endpoints that allow anonymous access use {@link #get()}; the others call
 * {@link #require()}.
 */
public final class CurrentUserHolder {

    private static final ThreadLocal<PlatformSecurityContext> CONTEXT = new ThreadLocal<>();

    private CurrentUserHolder() {
        // utility class
    }

    public static void set(PlatformSecurityContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
    }

    public static Optional<PlatformSecurityContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * Returns the current context.
     *
     * @throws AuthenticationRequiredException if the request is anonymous
     */
    public static PlatformSecurityContext require() {
        PlatformSecurityContext context = CONTEXT.get();
        if (context == null) {
            throw new AuthenticationRequiredException("Not authenticated");
        }
        return context;
    }

    /**
     * Returns the current context if it carries the ADMIN role.
     *
     * @throws AuthenticationRequiredException if the request is anonymous
     * @throws AccessDeniedException if the member is not an admin
     */
    public static PlatformSecurityContext requireAdmin() {
        PlatformSecurityContext context = require();
        if (!RoleChecker.hasRole(context, Role.ADMIN)) {
            throw new AccessDeniedException("Admin privileges required");
        }
        return context;
    }

    /** Id of the current member, or empty for anonymous requests. */
    public static Optional<Long> currentUserId() {
        return get().map(PlatformSecurityContext::userId);
    }
}
