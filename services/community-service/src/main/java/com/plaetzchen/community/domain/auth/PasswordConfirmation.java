package com.plaetzchen.community.domain.auth;

import jakarta.validation.constraints.NotBlank;

public record PasswordConfirmation(@NotBlank String password) {}
