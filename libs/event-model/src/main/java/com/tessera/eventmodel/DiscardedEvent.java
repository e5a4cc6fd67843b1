package com.tessera.eventmodel;

/**
 * Marker for an event that ends an entity's life. When it is the last event applied during
 * replay, repositories report the entity as absent.
 */
public interface DiscardedEvent extends DomainEvent {}
