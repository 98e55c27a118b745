package com.plaetzchen.community.domain.poll;

public record PollOptionView(long id, String text, int orderIndex, long voteCount) {}
