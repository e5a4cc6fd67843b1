package com.tessera.eventmodel;

/**
 * Thrown when a conditional append is rejected because an item already exists at one of the target
 * positions.
 *
 * <p>Another writer advanced the stream after the caller last read it. The whole batch was
 * rejected and the stream is unchanged; the caller must re-read current state and retry its
 * command.
 */
public class ConcurrencyException extends EventStoreException {

    private final String originatorId;
    private final long expectedVersion;

    public ConcurrencyException(String originatorId, long expectedVersion) {
        this(originatorId, expectedVersion, null);
    }

    public ConcurrencyException(String originatorId, long expectedVersion, Throwable cause) {
        super("Concurrent write detected for originator '%s': expected version %d is stale"
                .formatted(originatorId, expectedVersion), cause);
        this.originatorId = originatorId;
        this.expectedVersion = expectedVersion;
    }

    public String originatorId() {
        return originatorId;
    }

    /** Version the rejected writer believed was current, or {@code -1} for a new stream. */
    public long expectedVersion() {
        return expectedVersion;
    }
}
