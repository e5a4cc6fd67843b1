package com.tessera.eventmodel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Built-in event carrying a complete capture of an entity's state.
 *
 * <p>A replay can start from a snapshot instead of the stream's beginning. The snapshot is stored
 * like any other event under {@link #TOPIC}, either at the next position of the entity's own
 * stream or in a separate snapshot stream, and is covered by the hash chain of whichever stream
 * holds it.
 *
 * @param originatorId id of the entity whose state was captured
 * @param originatorVersion position of the snapshot item in the stream that holds it
 * @param stateType name of the captured state's class
 * @param state the captured state as a JSON tree
 * @param capturedVersion entity version at which the state was captured
 */
public record Snapshot(
        String originatorId,
        long originatorVersion,
        String stateType,
        JsonNode state,
        long capturedVersion)
        implements DomainEvent {

    /** Topic under which snapshots are stored. Always present in every {@link TopicRegistry}. */
    public static final String TOPIC = "tessera.Snapshot";
}
