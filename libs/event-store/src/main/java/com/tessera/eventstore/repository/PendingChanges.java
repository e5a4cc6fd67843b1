package com.tessera.eventstore.repository;

import com.tessera.eventmodel.DiscardedEvent;
import com.tessera.eventmodel.DomainEvent;
import java.util.ArrayList;
import java.util.List;

/**
 * Events triggered on an entity but not yet saved, with the state they lead to.
 *
 * <p>Not thread-safe: one instance belongs to one unit of work.
 *
 * @param <T> entity type
 */
public final class PendingChanges<T extends Replayable<T>> {

    /** Builds the next event for an entity. */
    @FunctionalInterface
    public interface EventBuilder<E extends DomainEvent> {
        E build(String originatorId, long originatorVersion);
    }

    private final long baseVersion;
    private final List<DomainEvent> events = new ArrayList<>();
    private T current;
    private boolean discarded;

    private PendingChanges(T base) {
        this.baseVersion = base.version();
        this.current = base;
    }

    public static <T extends Replayable<T>> PendingChanges<T> of(T entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        return new PendingChanges<>(entity);
    }

    /**
     * Builds the next event, applies it and keeps it for saving.
     *
     * @throws IllegalStateException if the entity has been discarded, or the event does not
     *     belong at the entity's next version
     */
    public PendingChanges<T> trigger(EventBuilder<?> builder) {
        if (discarded) {
            throw new IllegalStateException("Entity '%s' has been discarded".formatted(current.id()));
        }
        long nextVersion = current.version() + 1;
        DomainEvent event = builder.build(current.id(), nextVersion);
        if (!current.id().equals(event.originatorId()) || event.originatorVersion() != nextVersion) {
            throw new IllegalStateException(
                    "Event for '%s' at version %d does not follow '%s' at version %d"
                            .formatted(event.originatorId(), event.originatorVersion(),
                                    current.id(), current.version()));
        }
        T next = current.apply(event);
        if (next.version() != nextVersion) {
            throw new IllegalStateException(
                    "Applying %s left '%s' at version %d instead of %d"
                            .formatted(event.getClass().getSimpleName(), current.id(),
                                    next.version(), nextVersion));
        }
        events.add(event);
        current = next;
        discarded = event instanceof DiscardedEvent;
        return this;
    }

    /** State after every pending event. */
    public T current() {
        return current;
    }

    /** Version the entity had before any pending event. */
    public long baseVersion() {
        return baseVersion;
    }

    public List<DomainEvent> events() {
        return List.copyOf(events);
    }

    public boolean hasChanges() {
        return !events.isEmpty();
    }

    public boolean isDiscarded() {
        return discarded;
    }
}
