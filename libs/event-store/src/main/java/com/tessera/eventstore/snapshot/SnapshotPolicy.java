package com.tessera.eventstore.snapshot;

/**
 * Decides when a repository snapshots an entity on its own.
 *
 * @param period take a snapshot each time the stream length crosses a multiple of this; {@code 0}
 *     never does
 */
public record SnapshotPolicy(int period) {

    public SnapshotPolicy {
        if (period < 0) {
            throw new IllegalArgumentException("period must not be negative");
        }
    }

    public static SnapshotPolicy never() {
        return new SnapshotPolicy(0);
    }

    public static SnapshotPolicy every(int period) {
        return new SnapshotPolicy(period);
    }

    /**
     * Whether a save that moved the entity from {@code fromVersion} to {@code toVersion} crossed a
     * multiple of the period.
     */
    public boolean isDue(long fromVersion, long toVersion) {
        if (period == 0 || toVersion <= fromVersion) {
            return false;
        }
        return (toVersion + 1) / period > (fromVersion + 1) / period;
    }
}
