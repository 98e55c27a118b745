package com.plaetzchen.community.domain.forum;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ThreadCreate(@NotBlank @Size(max = 200) String title, @NotNull Long categoryId) {}
