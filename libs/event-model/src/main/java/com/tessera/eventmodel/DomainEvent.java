package com.tessera.eventmodel;

/**
 * Shape a domain event must have to be stored.
 *
 * <p>Implementations are expected to be immutable records whose remaining components serialize
 * with Jackson. The topic is not part of the event itself; it is resolved from the event's class
 * through a {@link TopicRegistry}.
 */
public interface DomainEvent {

    /** Identifier of the entity that emitted this event. */
    String originatorId();

    /** Version of the entity after this event, equal to the event's position in the stream. */
    long originatorVersion();
}
