package com.plaetzchen.community.domain.auth;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthStatusView(boolean authenticated, Long userId, Boolean emailVerified) {

    public static AuthStatusView anonymous() {
        return new AuthStatusView(false, null, null);
    }
}
