package com.plaetzchen.community.domain.poll;

/** {@code THREAD} polls live in a forum thread; {@code ADMIN} polls are platform-wide. */
public enum PollType {
    THREAD,
    ADMIN
}
