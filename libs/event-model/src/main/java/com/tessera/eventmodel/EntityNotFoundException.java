package com.tessera.eventmodel;

/**
 * Thrown by a repository when no snapshot and no events exist for an id, or when the last applied
 * event marks the entity as discarded.
 */
public class EntityNotFoundException extends EventStoreException {

    private final String entityId;

    public EntityNotFoundException(String entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
