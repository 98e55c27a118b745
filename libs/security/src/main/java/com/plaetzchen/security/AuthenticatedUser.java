package com.plaetzchen.security;

/**
 * The member behind a validated access token.
 * <p>
 * WHY a record: immutable and thread-safe, it is the "who" in every ownership and role
 * check made while serving a request.
 *
 * @param userId      database id of the member (JWT {@code sub} claim)
 * @param email       current email address
 * @param displayName public display name
 */
public record AuthenticatedUser(
        long userId,
        String email,
        String displayName
) {
}
