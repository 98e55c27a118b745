package com.plaetzchen.community.domain.forum;

import jakarta.validation.constraints.Size;

/** Partial thread update. Pinning and locking are reserved for admins. */
public record ThreadUpdate(
        @Size(min = 1, max = 200) String title, Long categoryId, Boolean isPinned, Boolean isLocked) {}
