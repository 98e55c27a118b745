package com.plaetzchen.community.domain.forum;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PostUpdate(@NotBlank @Size(max = 5000) String content) {}
