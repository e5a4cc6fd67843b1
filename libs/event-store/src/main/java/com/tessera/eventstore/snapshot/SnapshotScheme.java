package com.tessera.eventstore.snapshot;

/** Where snapshots are stored relative to the entity's own events. */
public enum SnapshotScheme {

    /**
     * Appended at the next position of the entity's stream and covered by its chain. Restoring a
     * snapshot at position {@code p} yields state at version {@code p}.
     */
    SHARED_CHAIN,

    /**
     * Stored in a stream of their own, at the position of the version they capture, chained only
     * to earlier snapshots of the same entity.
     */
    SEPARATE_STREAM
}
