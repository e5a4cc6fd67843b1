package com.tessera.eventstore.snapshot;

import java.util.Optional;

/** Takes and finds snapshots of entity state. */
public interface SnapshotStrategy {

    /** How this strategy lays snapshots out. */
    SnapshotScheme scheme();

    /**
     * Captures {@code state} as it stands at {@code version}.
     *
     * @param entityId id of the entity
     * @param state state to capture; must serialize to a JSON object
     * @param version entity version the state reflects
     * @return the stored snapshot
     * @throws StaleSnapshotException if a separate snapshot stream already covers {@code version}
     */
    StoredSnapshot takeSnapshot(String entityId, Object state, long version);

    /**
     * Finds the latest snapshot whose restored version is at or below {@code atMost}.
     *
     * @param atMost highest acceptable version, or null for the latest snapshot
     */
    Optional<StoredSnapshot> getSnapshot(String entityId, Long atMost);
}
