package com.plaetzchen.community.domain.auth;

public record TokenPurgeResult(int refreshTokens, int verificationTokens, int resetTokens) {

    public int total() {
        return refreshTokens + verificationTokens + resetTokens;
    }
}
