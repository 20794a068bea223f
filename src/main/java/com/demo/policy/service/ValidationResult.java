package com.demo.policy.service;

/**
 * Outcome of {@link ConsentValidator#validate}. Exactly one of {@code submission} / {@code errorKind} is set.
 */
public record ValidationResult(ConsentSubmission submission, ConsentErrorKind errorKind, String message) {

    public static ValidationResult accepted(ConsentSubmission normalized) {
        return new ValidationResult(normalized, null, null);
    }

    public static ValidationResult rejected(ConsentErrorKind kind, String message) {
        return new ValidationResult(null, kind, message);
    }

    public boolean isAccepted() {
        return errorKind == null;
    }
}
