package com.plaetzchen.security;

import java.util.List;

/**
 * Result of a security-related validation such as {@link PasswordPolicy#validate(String)}.
 *
 * @param valid  whether all checks passed
 * @param errors validation error messages (empty if valid)
 */
public record SecurityValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static SecurityValidationResult ok() {
        return new SecurityValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static SecurityValidationResult fail(List<String> errors) {
        return new SecurityValidationResult(false, List.copyOf(errors));
    }

    /** All error messages joined with "; ", suitable as an error detail. */
    public String summary() {
        return String.join("; ", errors);
    }
}
