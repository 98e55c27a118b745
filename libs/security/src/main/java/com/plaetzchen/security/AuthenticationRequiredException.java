package com.plaetzchen.security;

/**
 * Thrown when an endpoint needs a member but the request carried no valid access token.
 * Mapped to HTTP 401.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
