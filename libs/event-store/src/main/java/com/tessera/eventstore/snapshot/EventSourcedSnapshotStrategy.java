package com.tessera.eventstore.snapshot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.eventmodel.DomainEvent;
import com.tessera.eventmodel.EventSerializer;
import com.tessera.eventmodel.HashChain;
import com.tessera.eventmodel.MappingException;
import com.tessera.eventmodel.SequencedItem;
import com.tessera.eventmodel.SequencedItemMapper;
import com.tessera.eventmodel.Snapshot;
import com.tessera.eventstore.ActiveRecordStrategy;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.ItemQuery;
import com.tessera.eventstore.RecordedEvent;
import com.tessera.observability.EventStoreMetrics;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores snapshots as {@link Snapshot} events, in either {@link SnapshotScheme}.
 *
 * <p>With {@link SnapshotScheme#SHARED_CHAIN} the snapshot goes through the entity's own {@link
 * EventStore}, so it is subject to the same optimistic check as any other append: a snapshot taken
 * while another writer moves the stream fails with a concurrency conflict.
 *
 * <p>With {@link SnapshotScheme#SEPARATE_STREAM} the snapshot stream is sparse, so links are
 * checked between successive snapshots rather than between adjacent positions.
 */
public final class EventSourcedSnapshotStrategy implements SnapshotStrategy {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedSnapshotStrategy.class);

    private final SnapshotScheme scheme;
    private final EventStore eventStore;
    private final ActiveRecordStrategy snapshotRecords;
    private final SequencedItemMapper mapper;
    private final EventStoreMetrics metrics;

    private EventSourcedSnapshotStrategy(
            SnapshotScheme scheme,
            EventStore eventStore,
            ActiveRecordStrategy snapshotRecords,
            SequencedItemMapper mapper,
            EventStoreMetrics metrics) {
        this.scheme = scheme;
        this.eventStore = eventStore;
        this.snapshotRecords = snapshotRecords;
        this.mapper = mapper;
        this.metrics = metrics != null ? metrics : EventStoreMetrics.noop();
    }

    /** Snapshots appended to the entity streams of {@code eventStore}. */
    public static EventSourcedSnapshotStrategy sharedChain(EventStore eventStore) {
        return sharedChain(eventStore, EventStoreMetrics.noop());
    }

    public static EventSourcedSnapshotStrategy sharedChain(
            EventStore eventStore, EventStoreMetrics metrics) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore must not be null");
        }
        return new EventSourcedSnapshotStrategy(
                SnapshotScheme.SHARED_CHAIN, eventStore, null, eventStore.mapper(), metrics);
    }

    /** Snapshots kept in their own backend, one stream per entity. */
    public static EventSourcedSnapshotStrategy separateStream(
            ActiveRecordStrategy snapshotRecords, SequencedItemMapper mapper) {
        return separateStream(snapshotRecords, mapper, EventStoreMetrics.noop());
    }

    public static EventSourcedSnapshotStrategy separateStream(
            ActiveRecordStrategy snapshotRecords,
            SequencedItemMapper mapper,
            EventStoreMetrics metrics) {
        if (snapshotRecords == null || mapper == null) {
            throw new IllegalArgumentException("snapshotRecords and mapper must not be null");
        }
        return new EventSourcedSnapshotStrategy(
                SnapshotScheme.SEPARATE_STREAM, null, snapshotRecords, mapper, metrics);
    }

    @Override
    public SnapshotScheme scheme() {
        return scheme;
    }

    @Override
    public StoredSnapshot takeSnapshot(String entityId, Object state, long version) {
        if (version < 0) {
            throw new IllegalArgumentException("cannot snapshot an entity with no events");
        }
        ObjectNode captured = EventSerializer.toTree(state);
        String stateType = state.getClass().getName();

        StoredSnapshot stored = switch (scheme) {
            case SHARED_CHAIN -> appendToEntityStream(entityId, stateType, captured, version);
            case SEPARATE_STREAM -> appendToSnapshotStream(entityId, stateType, captured, version);
        };
        metrics.recordSnapshot();
        log.debug("Took snapshot of '{}' at version {}", entityId, version);
        return stored;
    }

    @Override
    public Optional<StoredSnapshot> getSnapshot(String entityId, Long atMost) {
        return switch (scheme) {
            case SHARED_CHAIN -> eventStore.getMostRecentEvent(entityId, Snapshot.TOPIC, atMost)
                    .map(recorded -> stored(recorded.event(), recorded.eventHash()));
            case SEPARATE_STREAM -> latestInSnapshotStream(entityId, atMost);
        };
    }

    /**
     * Binds a snapshot back to the entity type, with its version property set to the version the
     * restored entity carries.
     *
     * @throws MappingException if the snapshot was taken of a different type
     */
    public static <T> T restore(Snapshot snapshot, Class<T> stateType) {
        if (!stateType.getName().equals(snapshot.stateType())) {
            throw new MappingException(
                    "Snapshot of '%s' holds %s, not %s"
                            .formatted(snapshot.originatorId(), snapshot.stateType(), stateType.getName()));
        }
        ObjectNode state = snapshot.state().deepCopy();
        state.put("version", snapshot.originatorVersion());
        return EventSerializer.fromTree(state, stateType);
    }

    private StoredSnapshot appendToEntityStream(
            String entityId, String stateType, ObjectNode captured, long version) {
        var snapshot = new Snapshot(entityId, version + 1, stateType, captured, version);
        RecordedEvent recorded = eventStore.append(List.of(snapshot), version).get(0);
        return new StoredSnapshot(snapshot, recorded.eventHash());
    }

    private StoredSnapshot appendToSnapshotStream(
            String entityId, String stateType, ObjectNode captured, long version) {
        Optional<SequencedItem> latest = snapshotRecords.getLastItem(entityId);
        if (latest.isPresent() && latest.get().position() >= version) {
            throw new StaleSnapshotException(entityId, version, latest.get().position());
        }
        String previousHash = HashChain.GENESIS;
        if (latest.isPresent()) {
            mapper.verifyHash(latest.get());
            previousHash = latest.get().eventHash();
        }
        var snapshot = new Snapshot(entityId, version, stateType, captured, version);
        SequencedItem item = mapper.toSequencedItem(snapshot, previousHash);
        snapshotRecords.appendItems(List.of(item));
        return new StoredSnapshot(snapshot, item.eventHash());
    }

    private Optional<StoredSnapshot> latestInSnapshotStream(String entityId, Long atMost) {
        ItemQuery query = ItemQuery.forOriginator(entityId).inDescendingOrder().limitedTo(2);
        if (atMost != null) {
            query = query.atMost(atMost);
        }
        List<SequencedItem> items = snapshotRecords.getItems(query);
        if (items.isEmpty()) {
            return Optional.empty();
        }
        SequencedItem latest = items.get(0);
        String expected = HashChain.GENESIS;
        if (items.size() > 1) {
            mapper.verifyHash(items.get(1));
            expected = items.get(1).eventHash();
        }
        DomainEvent event = mapper.fromSequencedItem(latest, expected);
        return Optional.of(stored(event, latest.eventHash()));
    }

    private static StoredSnapshot stored(DomainEvent event, String eventHash) {
        if (!(event instanceof Snapshot snapshot)) {
            throw new MappingException(
                    "Expected a snapshot for '%s' but found %s"
                            .formatted(event.originatorId(), event.getClass().getName()));
        }
        return new StoredSnapshot(snapshot, eventHash);
    }
}
