package com.plaetzchen.community.domain.user;

import java.time.Instant;

/**
 * What other members see of a profile. Every field the owner marked private is {@code null}; the
 * display name is always visible.
 */
public record UserPublicView(
        long id,
        String displayName,
        String email,
        String firstName,
        String lastName,
        String bio,
        String location,
        Boolean isActive,
        Instant createdAt) {

    public static UserPublicView of(User u) {
        return new UserPublicView(
                u.getId(),
                u.getDisplayName(),
                u.isEmailPrivate() ? null : u.getEmail(),
                u.isFirstNamePrivate() ? null : u.getFirstName(),
                u.isLastNamePrivate() ? null : u.getLastName(),
                u.isBioPrivate() ? null : u.getBio(),
                u.isLocationPrivate() ? null : u.getLocation(),
                u.isActivePrivate() ? null : u.isActive(),
                u.isCreatedAtPrivate() ? null : u.getCreatedAt());
    }
}
