package com.tessera.eventstore;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.SequencedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed store for tests and embedded use.
 *
 * <p>A batch is checked and inserted under one write lock, so it lands whole or not at all, and
 * readers never observe part of a batch.
 */
public final class InMemoryActiveRecordStrategy implements ActiveRecordStrategy {

    private final Map<String, NavigableMap<Long, SequencedItem>> streams = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void appendItems(List<SequencedItem> items) {
        String originatorId = ActiveRecordStrategy.checkBatch(items);
        lock.writeLock().lock();
        try {
            NavigableMap<Long, SequencedItem> stream =
                    streams.computeIfAbsent(originatorId, id -> new TreeMap<>());
            for (SequencedItem item : items) {
                if (stream.containsKey(item.position())) {
                    throw new ConcurrencyException(originatorId, items.get(0).position() - 1);
                }
            }
            for (SequencedItem item : items) {
                stream.put(item.position(), item);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SequencedItem> getItems(ItemQuery query) {
        if (query.isEmptyRange()) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            NavigableMap<Long, SequencedItem> stream = streams.get(query.originatorId());
            if (stream == null) {
                return List.of();
            }
            NavigableMap<Long, SequencedItem> range =
                    stream.subMap(query.lowerBound(), true, query.upperBound(), true);
            if (!query.ascending()) {
                range = range.descendingMap();
            }
            var result = new ArrayList<SequencedItem>();
            for (SequencedItem item : range.values()) {
                if (query.limit() != null && result.size() >= query.limit()) {
                    break;
                }
                result.add(item);
            }
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Total number of items across all originators. */
    public int size() {
        lock.readLock().lock();
        try {
            return streams.values().stream().mapToInt(Map::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }
}
