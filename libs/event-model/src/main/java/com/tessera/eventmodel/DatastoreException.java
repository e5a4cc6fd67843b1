package com.tessera.eventmodel;

/**
 * Any backend failure that is not a concurrency conflict. Surfaced unchanged and never retried by
 * the store; retry policy, if any, belongs to the backend adapter or the caller.
 */
public class DatastoreException extends EventStoreException {

    public DatastoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
