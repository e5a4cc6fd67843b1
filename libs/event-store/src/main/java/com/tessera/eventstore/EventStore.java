package com.tessera.eventstore;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.DataIntegrityException;
import com.tessera.eventmodel.DomainEvent;
import com.tessera.eventmodel.HashChain;
import com.tessera.eventmodel.MappingException;
import com.tessera.eventmodel.SequencedItem;
import com.tessera.eventmodel.SequencedItemMapper;
import com.tessera.observability.EventStoreMetrics;
import com.tessera.observability.StoreTracing;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained log of domain events.
 *
 * <p>Writers state the version they last saw. The new items are chained to the stored item at
 * that version and handed to the backend in one atomic insert; if another writer got there first
 * the insert collides on (originator id, position) and the caller receives a {@link
 * ConcurrencyException}. The store never retries and never merges.
 *
 * <p>Every item read is verified before it is decoded: its own hash, its link to the item before
 * it, and that positions run without gaps. A read that finds a broken chain fails with {@link
 * DataIntegrityException} and returns nothing.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final ActiveRecordStrategy records;
    private final SequencedItemMapper mapper;
    private final int pageSize;
    private final EventStoreMetrics metrics;
    private final StoreTracing tracing;

    public EventStore(ActiveRecordStrategy records, SequencedItemMapper mapper) {
        this(records, mapper, DEFAULT_PAGE_SIZE, EventStoreMetrics.noop(), StoreTracing.noop());
    }

    /**
     * @param records storage backend
     * @param mapper converts events to items and verifies them on the way back
     * @param pageSize maximum number of items fetched by one backend query
     * @param metrics append, conflict, integrity and read meters
     * @param tracing span source for each operation
     */
    public EventStore(
            ActiveRecordStrategy records,
            SequencedItemMapper mapper,
            int pageSize,
            EventStoreMetrics metrics,
            StoreTracing tracing) {
        if (records == null || mapper == null) {
            throw new IllegalArgumentException("records and mapper must not be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.records = records;
        this.mapper = mapper;
        this.pageSize = pageSize;
        this.metrics = metrics != null ? metrics : EventStoreMetrics.noop();
        this.tracing = tracing != null ? tracing : StoreTracing.noop();
    }

    // ── Writes ──

    /**
     * Appends a batch of events for one originator, atomically.
     *
     * @param events events with versions {@code expectedVersion + 1}, {@code + 2}, ...
     * @param expectedVersion version of the stream the writer based its events on, {@code -1} for
     *     a new stream
     * @return the stored events with their hashes
     * @throws ConcurrencyException if the stream is no longer at {@code expectedVersion}
     * @throws MappingException if the batch mixes originators or its versions do not follow on
     * @throws DataIntegrityException if the item at {@code expectedVersion} fails verification
     */
    public List<RecordedEvent> append(List<? extends DomainEvent> events, long expectedVersion) {
        if (expectedVersion < -1) {
            throw new IllegalArgumentException("expectedVersion must be -1 or greater");
        }
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        String originatorId = checkBatch(events, expectedVersion);

        return tracing.inSpan("eventstore.append", originatorId, () -> {
            long started = System.nanoTime();
            String previousHash = integrityChecked(() -> previousHash(originatorId, expectedVersion));

            var items = new ArrayList<SequencedItem>(events.size());
            var recorded = new ArrayList<RecordedEvent>(events.size());
            for (DomainEvent event : events) {
                SequencedItem item = mapper.toSequencedItem(event, previousHash);
                items.add(item);
                recorded.add(new RecordedEvent(event, item.originatorHash(), item.eventHash()));
                previousHash = item.eventHash();
            }

            try {
                records.appendItems(items);
            } catch (ConcurrencyException e) {
                metrics.recordConflict();
                log.warn("Append to '{}' rejected: stream is no longer at version {}",
                        originatorId, expectedVersion);
                throw e;
            }

            metrics.recordAppend(items.size(), Duration.ofNanos(System.nanoTime() - started));
            log.debug("Appended {} event(s) to '{}' at positions {}..{}",
                    items.size(), originatorId,
                    items.get(0).position(), items.get(items.size() - 1).position());
            return List.copyOf(recorded);
        });
    }

    // ── Reads ──

    /** All events of the originator, oldest first. */
    public List<DomainEvent> getDomainEvents(String originatorId) {
        return getDomainEvents(originatorId, null, null, null);
    }

    /**
     * Events of the originator within an inclusive position range, oldest first.
     *
     * @param gte first position, or null for the start of the stream
     * @param lte last position, or null for the end of the stream
     * @param limit maximum number of events, or null
     */
    public List<DomainEvent> getDomainEvents(String originatorId, Long gte, Long lte, Integer limit) {
        ItemQuery query = new ItemQuery(originatorId, null, gte, null, lte, limit, true);
        return getRecordedEvents(query).stream().map(RecordedEvent::event).toList();
    }

    /** Verified events matching the query, in the query's order. */
    public List<RecordedEvent> getRecordedEvents(ItemQuery query) {
        return getRecordedEvents(query, null);
    }

    /**
     * Verified events matching the query, in the query's order.
     *
     * <p>The oldest item returned must link to {@code startingHash}. Without one, an item at
     * position 0 must link to {@link HashChain#GENESIS} and any other first item is trusted to
     * link to its stored originator hash; every later link is always checked.
     *
     * @param startingHash event hash of the item just before the range, or null
     * @throws DataIntegrityException if any returned item fails verification
     */
    public List<RecordedEvent> getRecordedEvents(ItemQuery query, String startingHash) {
        return tracing.inSpan("eventstore.read", query.originatorId(), () -> {
            long started = System.nanoTime();
            List<SequencedItem> items = readItems(query);

            List<SequencedItem> oldestFirst = query.ascending() ? items : reversed(items);
            boolean windowStartsAtLowerBound =
                    query.ascending() || query.limit() == null || items.size() < query.limit();
            List<RecordedEvent> events = integrityChecked(
                    () -> decode(oldestFirst, query, startingHash, windowStartsAtLowerBound));
            if (!query.ascending()) {
                events = reversed(events);
            }

            metrics.recordRead(events.size(), Duration.ofNanos(System.nanoTime() - started));
            log.debug("Read {} event(s) of '{}'", events.size(), query.originatorId());
            return List.copyOf(events);
        });
    }

    /** The event with the highest position, if the stream has any. */
    public Optional<RecordedEvent> getMostRecentEvent(String originatorId) {
        List<RecordedEvent> events = getRecordedEvents(
                ItemQuery.forOriginator(originatorId).inDescendingOrder().limitedTo(1));
        return events.stream().findFirst();
    }

    /**
     * The most recent event stored under a topic, at or below a position.
     *
     * <p>Scans the stream backwards page by page. The match is verified against the item before
     * it, so the result can serve as the starting hash of a read that continues after it.
     *
     * @param atMost highest position to consider, or null for the whole stream
     */
    public Optional<RecordedEvent> getMostRecentEvent(String originatorId, String topic, Long atMost) {
        return tracing.inSpan("eventstore.scan", originatorId, () -> {
            ItemQuery query = ItemQuery.forOriginator(originatorId).inDescendingOrder();
            if (atMost != null) {
                query = query.atMost(atMost);
            }
            Optional<SequencedItem> match = scanFor(query, topic);
            if (match.isEmpty()) {
                return Optional.<RecordedEvent>empty();
            }
            SequencedItem item = match.get();
            return Optional.of(integrityChecked(() -> {
                String expected = item.position() == 0
                        ? HashChain.GENESIS
                        : predecessorHash(originatorId, item.position());
                DomainEvent event = mapper.fromSequencedItem(item, expected);
                return new RecordedEvent(event, item.originatorHash(), item.eventHash());
            }));
        });
    }

    /** The event at exactly this position, if present. */
    public Optional<DomainEvent> getEvent(String originatorId, long position) {
        return getDomainEvents(originatorId, position, position, 1).stream().findFirst();
    }

    /**
     * Walks the whole stream and checks every hash and link without decoding any payload.
     *
     * @return the last position and its event hash
     * @throws DataIntegrityException at the first item that breaks the chain
     */
    public ChainHead verifyChain(String originatorId) {
        return tracing.inSpan("eventstore.verify", originatorId, () -> {
            List<SequencedItem> items = readItems(ItemQuery.forOriginator(originatorId));
            if (items.isEmpty()) {
                return ChainHead.empty(originatorId);
            }
            String head = integrityChecked(() -> {
                if (items.get(0).position() != 0) {
                    throw new DataIntegrityException(
                            originatorId, items.get(0).position(), "expected position 0");
                }
                return HashChain.verify(items, HashChain.GENESIS);
            });
            SequencedItem last = items.get(items.size() - 1);
            log.debug("Verified {} item(s) of '{}'", items.size(), originatorId);
            return new ChainHead(originatorId, last.position(), head);
        });
    }

    public SequencedItemMapper mapper() {
        return mapper;
    }

    public int pageSize() {
        return pageSize;
    }

    // ── Internals ──

    private static String checkBatch(List<? extends DomainEvent> events, long expectedVersion) {
        String originatorId = events.get(0).originatorId();
        long expected = expectedVersion + 1;
        for (DomainEvent event : events) {
            if (event.originatorId() == null || !event.originatorId().equals(originatorId)) {
                throw new MappingException(
                        "Batch mixes originators '%s' and '%s'"
                                .formatted(originatorId, event.originatorId()));
            }
            if (event.originatorVersion() != expected) {
                throw new MappingException(
                        "Event for '%s' has version %d but %d was expected"
                                .formatted(originatorId, event.originatorVersion(), expected));
            }
            expected++;
        }
        return originatorId;
    }

    private String previousHash(String originatorId, long expectedVersion) {
        if (expectedVersion == -1) {
            return HashChain.GENESIS;
        }
        SequencedItem previous = records.getItem(originatorId, expectedVersion)
                .orElseThrow(() -> {
                    log.warn("Append to '{}' rejected: no item at expected version {}",
                            originatorId, expectedVersion);
                    metrics.recordConflict();
                    return new ConcurrencyException(originatorId, expectedVersion);
                });
        mapper.verifyHash(previous);
        return previous.eventHash();
    }

    private String predecessorHash(String originatorId, long position) {
        SequencedItem previous = records.getItem(originatorId, position - 1)
                .orElseThrow(() -> new DataIntegrityException(
                        originatorId, position - 1, "item is missing"));
        mapper.verifyHash(previous);
        return previous.eventHash();
    }

    private List<RecordedEvent> decode(
            List<SequencedItem> oldestFirst,
            ItemQuery query,
            String startingHash,
            boolean windowStartsAtLowerBound) {
        if (oldestFirst.isEmpty()) {
            return List.of();
        }
        SequencedItem first = oldestFirst.get(0);
        if (windowStartsAtLowerBound && first.position() != query.lowerBound()) {
            throw new DataIntegrityException(
                    first.originatorId(), first.position(), "expected position " + query.lowerBound());
        }
        String expected;
        if (startingHash != null) {
            expected = startingHash;
        } else if (first.position() == 0) {
            expected = HashChain.GENESIS;
        } else {
            expected = first.originatorHash();
        }

        var events = new ArrayList<RecordedEvent>(oldestFirst.size());
        long expectedPosition = first.position();
        for (SequencedItem item : oldestFirst) {
            if (item.position() != expectedPosition) {
                throw new DataIntegrityException(
                        item.originatorId(), item.position(), "expected position " + expectedPosition);
            }
            DomainEvent event = mapper.fromSequencedItem(item, expected);
            events.add(new RecordedEvent(event, item.originatorHash(), item.eventHash()));
            expected = item.eventHash();
            expectedPosition++;
        }
        return events;
    }

    private List<SequencedItem> readItems(ItemQuery query) {
        var items = new ArrayList<SequencedItem>();
        ItemQuery page = query;
        while (true) {
            int wanted = pageSize;
            if (query.limit() != null) {
                wanted = Math.min(pageSize, query.limit() - items.size());
                if (wanted <= 0) {
                    break;
                }
            }
            List<SequencedItem> batch = records.getItems(page.limitedTo(wanted));
            items.addAll(batch);
            if (batch.size() < wanted) {
                break;
            }
            long last = batch.get(batch.size() - 1).position();
            page = query.ascending() ? page.greaterThan(last) : page.lessThan(last);
        }
        return items;
    }

    private Optional<SequencedItem> scanFor(ItemQuery descending, String topic) {
        ItemQuery page = descending;
        while (true) {
            List<SequencedItem> batch = records.getItems(page.limitedTo(pageSize));
            for (SequencedItem item : batch) {
                if (topic.equals(item.topic())) {
                    return Optional.of(item);
                }
            }
            if (batch.size() < pageSize) {
                return Optional.empty();
            }
            page = page.lessThan(batch.get(batch.size() - 1).position());
        }
    }

    private static <T> List<T> reversed(List<T> list) {
        var copy = new ArrayList<>(list);
        Collections.reverse(copy);
        return copy;
    }

    private <T> T integrityChecked(Supplier<T> work) {
        try {
            return work.get();
        } catch (DataIntegrityException e) {
            metrics.recordIntegrityFailure();
            log.error("Integrity check failed for '{}' at position {}: {}",
                    e.originatorId(), e.position(), e.getMessage());
            throw e;
        }
    }
}
