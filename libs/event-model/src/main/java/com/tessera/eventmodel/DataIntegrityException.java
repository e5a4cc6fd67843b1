package com.tessera.eventmodel;

/**
 * Thrown when a stored item fails hash verification or does not link to its predecessor.
 *
 * <p>Fatal for the read that detected it. The offending item is never skipped or replaced with a
 * default; the caller learns exactly where the chain broke.
 */
public class DataIntegrityException extends EventStoreException {

    private final String originatorId;
    private final long position;

    public DataIntegrityException(String originatorId, long position, String reason) {
        this(originatorId, position, reason, null);
    }

    public DataIntegrityException(
            String originatorId, long position, String reason, Throwable cause) {
        super("Integrity check failed for originator '%s' at position %d: %s"
                .formatted(originatorId, position, reason), cause);
        this.originatorId = originatorId;
        this.position = position;
    }

    public String originatorId() {
        return originatorId;
    }

    /** Position at which the break was detected. */
    public long position() {
        return position;
    }
}
