package com.tessera.eventstore.snapshot;

import com.tessera.eventmodel.Snapshot;

/**
 * A snapshot read back from its stream.
 *
 * @param snapshot the decoded snapshot
 * @param eventHash event hash of the item holding it
 */
public record StoredSnapshot(Snapshot snapshot, String eventHash) {

    /** Entity version the restored state will carry. */
    public long restoredVersion() {
        return snapshot.originatorVersion();
    }
}
