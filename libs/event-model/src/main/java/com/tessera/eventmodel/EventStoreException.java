package com.tessera.eventmodel;

/**
 * Root of the event store's exception taxonomy.
 *
 * <p>Unchecked: every failure propagates to the caller, and the store performs no silent recovery.
 * Callers that want to react to a specific condition catch the subclass they care about, most
 * commonly {@link ConcurrencyException}.
 */
public abstract class EventStoreException extends RuntimeException {

    protected EventStoreException(String message) {
        super(message);
    }

    protected EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
