package com.tessera.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the fields the mapper relies on before it serializes an event or deserializes an item.
 *
 * <p>Returns every problem at once in a {@link ValidationResult} rather than stopping at the
 * first.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /** Validates the identifying fields of a domain event. */
    public static ValidationResult validate(DomainEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(event.originatorId())) {
            errors.add("originatorId must not be null or blank");
        }
        if (event.originatorVersion() < 0) {
            errors.add("originatorVersion must be >= 0");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /** Validates that a stored item carries every field needed to verify and decode it. */
    public static ValidationResult validate(SequencedItem item) {
        if (item == null) {
            return ValidationResult.fail(List.of("item must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(item.originatorId())) {
            errors.add("originatorId must not be null or blank");
        }
        if (item.position() < 0) {
            errors.add("position must be >= 0");
        }
        if (isBlank(item.topic())) {
            errors.add("topic must not be null or blank");
        }
        if (item.state() == null) {
            errors.add("state must not be null");
        }
        if (item.originatorHash() == null) {
            errors.add("originatorHash must not be null");
        }
        if (isBlank(item.eventHash())) {
            errors.add("eventHash must not be null or blank");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
