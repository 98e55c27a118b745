package com.plaetzchen.community.domain.user;

import java.time.Instant;

/** Everything a member may see about themselves, including privacy and notification settings. */
public record UserPrivateView(
        long id,
        String displayName,
        String email,
        String firstName,
        String lastName,
        String bio,
        String location,
        boolean isActive,
        boolean isAdmin,
        boolean emailVerified,
        Instant emailVerifiedAt,
        Instant createdAt,
        boolean emailPrivate,
        boolean firstNamePrivate,
        boolean lastNamePrivate,
        boolean bioPrivate,
        boolean locationPrivate,
        boolean createdAtPrivate,
        boolean isActivePrivate,
        boolean notifyForumReply,
        boolean notifyForumMention,
        boolean notifyForumQuote,
        boolean notifyEventJoin,
        boolean notifyCommentReply,
        boolean emailNotificationsEvents,
        boolean emailNotificationsMessages,
        boolean emailNotificationsNewsletter) {

    public static UserPrivateView of(User u) {
        return new UserPrivateView(
                u.getId(),
                u.getDisplayName(),
                u.getEmail(),
                u.getFirstName(),
                u.getLastName(),
                u.getBio(),
                u.getLocation(),
                u.isActive(),
                u.isAdmin(),
                u.isEmailVerified(),
                u.getEmailVerifiedAt(),
                u.getCreatedAt(),
                u.isEmailPrivate(),
                u.isFirstNamePrivate(),
                u.isLastNamePrivate(),
                u.isBioPrivate(),
                u.isLocationPrivate(),
                u.isCreatedAtPrivate(),
                u.isActivePrivate(),
                u.isNotifyForumReply(),
                u.isNotifyForumMention(),
                u.isNotifyForumQuote(),
                u.isNotifyEventJoin(),
                u.isNotifyCommentReply(),
                u.isEmailNotificationsEvents(),
                u.isEmailNotificationsMessages(),
                u.isEmailNotificationsNewsletter());
    }
}
