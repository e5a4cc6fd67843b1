package com.tessera.eventstore;

import com.tessera.eventmodel.DomainEvent;

/**
 * A domain event as it sits in the store, with the hashes that place it in its chain.
 *
 * @param event the decoded event
 * @param originatorHash event hash of the preceding item
 * @param eventHash this item's event hash
 */
public record RecordedEvent(DomainEvent event, String originatorHash, String eventHash) {

    public String originatorId() {
        return event.originatorId();
    }

    /** Position in the stream, equal to the event's originator version. */
    public long position() {
        return event.originatorVersion();
    }
}
