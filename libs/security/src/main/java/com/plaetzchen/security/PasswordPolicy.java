package com.plaetzchen.security;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Password strength rules applied on registration and password reset.
 * <p>
 * WHY manual validation: returns every failed rule at once, so the client can show all hints
 * in one round trip.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    private PasswordPolicy() {
        // utility class
    }

    public static SecurityValidationResult validate(String password) {
        if (password == null) {
            return SecurityValidationResult.fail(java.util.List.of("Password must not be empty"));
        }
        var errors = new ArrayList<String>();
        if (password.length() < MIN_LENGTH) {
            errors.add("Password must be at least " + MIN_LENGTH + " characters");
        }
        if (!DIGIT.matcher(password).find()) {
            errors.add("Password must contain at least one digit");
        }
        if (!UPPERCASE.matcher(password).find()) {
            errors.add("Password must contain at least one uppercase letter");
        }
        if (!SPECIAL.matcher(password).find()) {
            errors.add("Password must contain at least one special character");
        }
        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }
}
