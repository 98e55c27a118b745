package com.plaetzchen.community.domain.user;

/** Minimal member reference embedded in other resources (creator, author, participant). */
public record UserSummary(long id, String displayName) {

    public static UserSummary of(User user) {
        return new UserSummary(user.getId(), user.getDisplayName());
    }
}
