package com.plaetzchen.security;

/**
 * Role-based access checks with hierarchy support.
 * <p>
 * WHY a utility class: the hierarchy lookup is the same everywhere, so controllers and domain
 * services ask here instead of comparing role sets themselves.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the context has the required role, directly or via hierarchy.
     */
    public static boolean hasRole(PlatformSecurityContext context, Role required) {
        return context.roles().stream()
                .anyMatch(userRole -> userRole.implies(required));
    }

    /**
     * Checks if the context has ANY of the required roles.
     */
    public static boolean hasAnyRole(PlatformSecurityContext context, Role... required) {
        for (Role role : required) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }
}
