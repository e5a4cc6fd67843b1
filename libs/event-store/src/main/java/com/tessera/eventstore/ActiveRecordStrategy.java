package com.tessera.eventstore;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.DatastoreException;
import com.tessera.eventmodel.SequencedItem;
import java.util.List;
import java.util.Optional;

/**
 * Contract every storage backend must meet.
 *
 * <p>The backend's atomic conditional insert is the store's only mutual-exclusion mechanism; there
 * is no locking anywhere above it. Implementations must:
 *
 * <ul>
 *   <li>keep (originator id, position) unique;
 *   <li>apply a batch entirely or not at all, rejecting the whole batch with {@link
 *       ConcurrencyException} if any of its positions is already taken;
 *   <li>return items strictly ordered by position, never skipping or duplicating one;
 *   <li>translate every other failure to {@link DatastoreException}.
 * </ul>
 */
public interface ActiveRecordStrategy {

    /**
     * Atomically inserts a batch of items belonging to one originator.
     *
     * @param items items with consecutive positions, in ascending order
     * @throws ConcurrencyException if any (originator id, position) already exists
     * @throws DatastoreException on any other backend failure
     */
    void appendItems(List<SequencedItem> items);

    /**
     * Returns the items matching the query, ordered by position.
     *
     * @throws DatastoreException on backend failure
     */
    List<SequencedItem> getItems(ItemQuery query);

    /** Returns the item at exactly this position, if present. */
    default Optional<SequencedItem> getItem(String originatorId, long position) {
        List<SequencedItem> items =
                getItems(ItemQuery.forOriginator(originatorId).atLeast(position).atMost(position));
        return items.stream().findFirst();
    }

    /** Returns the item with the highest position, if the stream has any. */
    default Optional<SequencedItem> getLastItem(String originatorId) {
        List<SequencedItem> items =
                getItems(ItemQuery.forOriginator(originatorId).inDescendingOrder().limitedTo(1));
        return items.stream().findFirst();
    }

    /**
     * Checks the shape of a batch before any backend sees it.
     *
     * @return the originator id shared by every item
     * @throws IllegalArgumentException if the batch is empty, mixes originators, or its positions
     *     are not consecutive and ascending
     */
    static String checkBatch(List<SequencedItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }
        String originatorId = items.get(0).originatorId();
        long expected = items.get(0).position();
        for (SequencedItem item : items) {
            if (!originatorId.equals(item.originatorId())) {
                throw new IllegalArgumentException(
                        "batch mixes originators '%s' and '%s'"
                                .formatted(originatorId, item.originatorId()));
            }
            if (item.position() != expected) {
                throw new IllegalArgumentException(
                        "batch positions must be consecutive: expected %d but got %d"
                                .formatted(expected, item.position()));
            }
            expected++;
        }
        return originatorId;
    }
}
