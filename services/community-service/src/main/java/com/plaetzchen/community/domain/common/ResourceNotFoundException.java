package com.plaetzchen.community.domain.common;

/**
 * Thrown when a requested entity does not exist or is not visible (e.g. soft-deleted).
 * Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
