package com.tessera.eventstore.repository;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.DataIntegrityException;
import com.tessera.eventmodel.DiscardedEvent;
import com.tessera.eventmodel.DomainEvent;
import com.tessera.eventmodel.EntityNotFoundException;
import com.tessera.eventmodel.Snapshot;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.ItemQuery;
import com.tessera.eventstore.RecordedEvent;
import com.tessera.eventstore.snapshot.EventSourcedSnapshotStrategy;
import com.tessera.eventstore.snapshot.SnapshotPolicy;
import com.tessera.eventstore.snapshot.SnapshotScheme;
import com.tessera.eventstore.snapshot.SnapshotStrategy;
import com.tessera.eventstore.snapshot.StaleSnapshotException;
import com.tessera.eventstore.snapshot.StoredSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads entities by replaying their events and saves the events they trigger.
 *
 * <p>Loading starts from the latest usable snapshot, if a {@link SnapshotStrategy} is configured,
 * and applies only the events after it. Saving appends the pending events under the version the
 * entity was loaded at; a conflict is passed to the caller untouched, so the caller decides
 * whether to reload and retry.
 *
 * @param <T> entity type
 */
public class EventSourcedRepository<T extends Replayable<T>> {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore eventStore;
    private final Class<T> stateType;
    private final Function<String, T> initialState;
    private final SnapshotStrategy snapshots;
    private final SnapshotPolicy policy;

    public EventSourcedRepository(
            EventStore eventStore, Class<T> stateType, Function<String, T> initialState) {
        this(eventStore, stateType, initialState, null, SnapshotPolicy.never());
    }

    /**
     * @param eventStore store holding the entity streams
     * @param stateType entity class, used to restore snapshots
     * @param initialState state at version {@code -1} for a given id
     * @param snapshots snapshot strategy, or null to always replay from the start
     * @param policy when to snapshot after a save
     */
    public EventSourcedRepository(
            EventStore eventStore,
            Class<T> stateType,
            Function<String, T> initialState,
            SnapshotStrategy snapshots,
            SnapshotPolicy policy) {
        if (eventStore == null || stateType == null || initialState == null) {
            throw new IllegalArgumentException("eventStore, stateType and initialState are required");
        }
        if (snapshots == null && policy != null && policy.period() > 0) {
            throw new IllegalArgumentException("a snapshot policy needs a snapshot strategy");
        }
        this.eventStore = eventStore;
        this.stateType = stateType;
        this.initialState = initialState;
        this.snapshots = snapshots;
        this.policy = policy != null ? policy : SnapshotPolicy.never();
    }

    /**
     * Latest state of the entity.
     *
     * @throws EntityNotFoundException if the entity has no events or has been discarded
     * @throws DataIntegrityException if its stream fails verification
     */
    public T get(String entityId) {
        return get(entityId, null);
    }

    /**
     * State of the entity as of a version.
     *
     * @param atVersion last version to apply, or null for the latest
     * @throws EntityNotFoundException if the entity has no events up to that version or was
     *     discarded by then
     */
    public T get(String entityId, Long atVersion) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be null or blank");
        }
        if (atVersion != null && atVersion < 0) {
            throw new EntityNotFoundException(entityId);
        }

        T state = null;
        String chainHash = null;
        Optional<StoredSnapshot> snapshot = findSnapshot(entityId, atVersion);
        if (snapshot.isPresent()) {
            state = EventSourcedSnapshotStrategy.restore(snapshot.get().snapshot(), stateType);
            if (snapshots.scheme() == SnapshotScheme.SHARED_CHAIN) {
                chainHash = snapshot.get().eventHash();
            }
        }
        boolean fromSnapshot = state != null;
        if (state == null) {
            state = initialState.apply(entityId);
        }

        ItemQuery query = ItemQuery.forOriginator(entityId).greaterThan(state.version());
        if (atVersion != null) {
            query = query.atMost(atVersion);
        }
        List<RecordedEvent> events = eventStore.getRecordedEvents(query, chainHash);

        DomainEvent last = null;
        for (RecordedEvent recorded : events) {
            state = replay(state, recorded.event());
            last = recorded.event();
        }

        if (!fromSnapshot && last == null) {
            throw new EntityNotFoundException(entityId);
        }
        if (last instanceof DiscardedEvent) {
            throw new EntityNotFoundException(entityId);
        }
        log.debug("Loaded '{}' at version {} ({} event(s) replayed{})",
                entityId, state.version(), events.size(), fromSnapshot ? " after snapshot" : "");
        return state;
    }

    public Optional<T> find(String entityId) {
        try {
            return Optional.of(get(entityId));
        } catch (EntityNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean contains(String entityId) {
        return find(entityId).isPresent();
    }

    /** Pending changes over a brand-new entity at version {@code -1}. */
    public PendingChanges<T> create(String entityId) {
        T initial = initialState.apply(entityId);
        if (initial.version() != -1) {
            throw new IllegalStateException("initial state of '%s' must be at version -1".formatted(entityId));
        }
        return PendingChanges.of(initial);
    }

    public PendingChanges<T> edit(T entity) {
        return PendingChanges.of(entity);
    }

    /**
     * Appends the pending events and returns the committed entity.
     *
     * <p>When the snapshot policy is due, a snapshot is taken afterwards. In the shared-chain
     * scheme the snapshot occupies the next position, so the returned entity carries that
     * position as its version.
     *
     * @throws ConcurrencyException if the entity moved since it was loaded
     */
    public T save(PendingChanges<T> changes) {
        if (!changes.hasChanges()) {
            return changes.current();
        }
        T committed = changes.current();
        eventStore.append(changes.events(), changes.baseVersion());
        log.debug("Saved {} event(s) for '{}', now at version {}",
                changes.events().size(), committed.id(), committed.version());

        if (snapshots != null && !changes.isDiscarded()
                && policy.isDue(changes.baseVersion(), committed.version())) {
            return snapshotAfterSave(committed);
        }
        return committed;
    }

    /**
     * Snapshots the entity's latest state.
     *
     * @throws IllegalStateException if no snapshot strategy is configured
     * @throws StaleSnapshotException if a separate-stream snapshot already covers that version
     */
    public StoredSnapshot takeSnapshot(String entityId) {
        if (snapshots == null) {
            throw new IllegalStateException("no snapshot strategy configured");
        }
        T state = get(entityId);
        return snapshots.takeSnapshot(entityId, state, state.version());
    }

    public Optional<SnapshotStrategy> snapshotStrategy() {
        return Optional.ofNullable(snapshots);
    }

    private Optional<StoredSnapshot> findSnapshot(String entityId, Long atVersion) {
        if (snapshots == null) {
            return Optional.empty();
        }
        return snapshots.getSnapshot(entityId, atVersion);
    }

    private T replay(T state, DomainEvent event) {
        if (event instanceof Snapshot snapshot) {
            return EventSourcedSnapshotStrategy.restore(snapshot, stateType);
        }
        T next = state.apply(event);
        if (next.version() != event.originatorVersion()) {
            throw new IllegalStateException(
                    "Applying %s left '%s' at version %d instead of %d"
                            .formatted(event.getClass().getSimpleName(), state.id(),
                                    next.version(), event.originatorVersion()));
        }
        return next;
    }

    private T snapshotAfterSave(T committed) {
        try {
            StoredSnapshot stored = snapshots.takeSnapshot(committed.id(), committed, committed.version());
            if (snapshots.scheme() == SnapshotScheme.SHARED_CHAIN) {
                return EventSourcedSnapshotStrategy.restore(stored.snapshot(), stateType);
            }
            return committed;
        } catch (ConcurrencyException e) {
            // the events are committed; only the snapshot lost the race
            log.warn("Snapshot of '{}' at version {} skipped: stream moved on",
                    committed.id(), committed.version());
            return committed;
        } catch (StaleSnapshotException e) {
            log.warn("Snapshot of '{}' at version {} skipped: a snapshot at version {} already exists",
                    committed.id(), committed.version(), e.latestVersion());
            return committed;
        }
    }
}
