package com.plaetzchen.community.domain.user;

import jakarta.validation.constraints.Size;

/**
 * Partial profile update: {@code null} leaves a field unchanged.
 */
public record ProfileUpdate(
        @Size(min = 2, max = 20) String displayName,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 1000) String bio,
        @Size(max = 200) String location,
        Boolean emailPrivate,
        Boolean firstNamePrivate,
        Boolean lastNamePrivate,
        Boolean bioPrivate,
        Boolean locationPrivate,
        Boolean createdAtPrivate,
        Boolean isActivePrivate,
        Boolean notifyForumReply,
        Boolean notifyForumMention,
        Boolean notifyForumQuote,
        Boolean notifyEventJoin,
        Boolean notifyCommentReply,
        Boolean emailNotificationsEvents,
        Boolean emailNotificationsMessages,
        Boolean emailNotificationsNewsletter) {}
