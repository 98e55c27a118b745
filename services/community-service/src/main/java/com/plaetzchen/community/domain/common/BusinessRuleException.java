package com.plaetzchen.community.domain.common;

/**
 * Thrown when a well-formed request breaks a community rule (joining a full event, posting in a
 * locked thread, voting on an ended poll). Mapped to HTTP 400.
 */
public class BusinessRuleException extends RuntimeException {

    public BusinessRuleException(String message) {
        super(message);
    }
}
