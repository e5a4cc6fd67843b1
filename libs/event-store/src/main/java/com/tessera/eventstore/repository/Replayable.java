package com.tessera.eventstore.repository;

import com.tessera.eventmodel.DomainEvent;

/**
 * Immutable entity state rebuilt by replaying its events.
 *
 * <p>Implementations are captured and restored with Jackson when snapshotting, so they must
 * serialize to a JSON object whose version property is named {@code version}.
 *
 * @param <T> the implementing type
 */
public interface Replayable<T extends Replayable<T>> {

    String id();

    /** Position of the last event applied, {@code -1} before the first. */
    long version();

    /**
     * Returns the state after {@code event}. The result's version must equal the event's
     * originator version.
     */
    T apply(DomainEvent event);
}
