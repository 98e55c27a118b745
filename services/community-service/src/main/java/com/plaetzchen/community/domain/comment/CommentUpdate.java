package com.plaetzchen.community.domain.comment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CommentUpdate(@NotBlank @Size(max = 1000) String content) {}
