package com.goormthonuniv.trialguard.exception;

import java.util.List;

/**
 * Structurally malformed input rejected at the boundary (wrong JSON type, unknown enum value,
 * violated constraint). Carries every field error found, not just the first.
 */
public class InvalidInputException extends RuntimeException {

    private final List<String> errors;

    public InvalidInputException(String subject, List<String> errors) {
        super("Invalid " + subject + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
