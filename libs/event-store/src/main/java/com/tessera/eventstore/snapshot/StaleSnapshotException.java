package com.tessera.eventstore.snapshot;

/**
 * Thrown when a snapshot would not advance its stream: the latest stored snapshot already covers
 * the requested version.
 */
public class StaleSnapshotException extends IllegalArgumentException {

    private final String entityId;
    private final long version;
    private final long latestVersion;

    public StaleSnapshotException(String entityId, long version, long latestVersion) {
        super("Snapshot of '%s' at version %d is not after the latest one at %d"
                .formatted(entityId, version, latestVersion));
        this.entityId = entityId;
        this.version = version;
        this.latestVersion = latestVersion;
    }

    public String entityId() {
        return entityId;
    }

    public long version() {
        return version;
    }

    public long latestVersion() {
        return latestVersion;
    }
}
