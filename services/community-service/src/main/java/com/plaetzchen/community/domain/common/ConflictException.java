package com.plaetzchen.community.domain.common;

/**
 * Thrown when a request clashes with existing state: a taken display name, a duplicate category,
 * a category that still has content. Mapped to HTTP 409.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
