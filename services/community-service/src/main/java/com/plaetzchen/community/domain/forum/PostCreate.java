package com.plaetzchen.community.domain.forum;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** New post, optionally quoting an earlier post of the same thread. */
public record PostCreate(@NotBlank @Size(max = 5000) String content, Long quotedPostId) {}
