package com.plaetzchen.community.domain.poll;

public record PollStatsView(long pollsCreated, long votesCast, String engagementLevel) {}
