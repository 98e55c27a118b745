package com.plaetzchen.security;

/**
 * Thrown when an authenticated member attempts an action reserved for the owner of a
 * resource or for admins. Mapped to HTTP 403.
 * <p>
 * WHY a RuntimeException: the caller cannot recover from it; the request simply fails.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
