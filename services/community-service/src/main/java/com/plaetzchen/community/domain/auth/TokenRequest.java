package com.plaetzchen.community.domain.auth;

import jakarta.validation.constraints.NotBlank;

/** Carries a mailed verification token. */
public record TokenRequest(@NotBlank String token) {}
