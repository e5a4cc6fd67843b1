package com.tessera.eventmodel;

/**
 * Thrown when a domain event cannot be converted to or from a {@link SequencedItem}: missing
 * required fields, an unrecognized topic, or a malformed payload.
 */
public class MappingException extends EventStoreException {

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
