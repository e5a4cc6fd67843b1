package com.tessera.eventmodel;

import java.util.List;

/**
 * Result of validating an event or a stored item.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Throws a {@link MappingException} listing every error, prefixed by {@code subject}, unless
     * the result is valid.
     */
    public void orThrow(String subject) {
        if (!valid) {
            throw new MappingException(subject + " is invalid: " + String.join("; ", errors));
        }
    }
}
