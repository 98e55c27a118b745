package com.plaetzchen.community.domain.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Sign-up form. The password is checked against the password policy in the service. */
public record RegisterRequest(
        @NotBlank @Size(min = 2, max = 20) String displayName,
        @NotBlank @Email String email,
        @NotBlank String password,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 1000) String bio,
        @Size(max = 200) String location) {}
