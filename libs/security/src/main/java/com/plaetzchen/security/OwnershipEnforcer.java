package com.plaetzchen.security;

/**
 * Enforces the "owner or admin" rule on member-created content.
 * <p>
 * WHY a utility class: events, listings, threads, posts, polls and comments all share this
 * rule. Fail-fast with {@link AccessDeniedException} keeps each service's mutation paths short.
 */
public final class OwnershipEnforcer {

    private OwnershipEnforcer() {
        // utility class
    }

    /**
     * Returns true when the context's member owns the resource or is an admin.
     */
    public static boolean isOwnerOrAdmin(PlatformSecurityContext context, Long ownerId) {
        if (context.isAdmin()) {
            return true;
        }
        return ownerId != null && ownerId == context.userId();
    }

    /**
     * Verifies that the context's member owns the resource or is an admin.
     *
     * @param context the authenticated security context
     * @param ownerId id of the member owning the resource
     * @param message detail reported to the client when access is denied
     * @throws AccessDeniedException if the member is neither owner nor admin
     */
    public static void enforce(PlatformSecurityContext context, Long ownerId, String message) {
        if (!isOwnerOrAdmin(context, ownerId)) {
            throw new AccessDeniedException(message);
        }
    }
}
