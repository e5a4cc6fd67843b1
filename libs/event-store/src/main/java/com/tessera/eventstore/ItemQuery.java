package com.tessera.eventstore;

/**
 * Position range over one originator's items.
 *
 * <p>Bounds are optional and combine: {@code gt}/{@code gte} for the lower end, {@code
 * lt}/{@code lte} for the upper end. Results are ordered by position, ascending unless {@link
 * #inDescendingOrder()} is applied, and cut to {@code limit} items after ordering.
 *
 * <pre>{@code
 * ItemQuery.forOriginator("acc-1").atLeast(10).atMost(20);
 * ItemQuery.forOriginator("acc-1").inDescendingOrder().limitedTo(1);   // last item
 * }</pre>
 *
 * @param originatorId stream to read
 * @param gt exclusive lower bound, or null
 * @param gte inclusive lower bound, or null
 * @param lt exclusive upper bound, or null
 * @param lte inclusive upper bound, or null
 * @param limit maximum number of items, or null for no limit
 * @param ascending order of the results
 */
public record ItemQuery(
        String originatorId, Long gt, Long gte, Long lt, Long lte, Integer limit, boolean ascending) {

    public ItemQuery {
        if (originatorId == null || originatorId.isBlank()) {
            throw new IllegalArgumentException("originatorId must not be null or blank");
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    /** Every item of the originator, ascending. */
    public static ItemQuery forOriginator(String originatorId) {
        return new ItemQuery(originatorId, null, null, null, null, null, true);
    }

    /** Positions strictly greater than {@code position}; replaces any lower bound. */
    public ItemQuery greaterThan(long position) {
        return new ItemQuery(originatorId, position, null, lt, lte, limit, ascending);
    }

    /** Positions greater than or equal to {@code position}; replaces any lower bound. */
    public ItemQuery atLeast(long position) {
        return new ItemQuery(originatorId, null, position, lt, lte, limit, ascending);
    }

    /** Positions strictly less than {@code position}; replaces any upper bound. */
    public ItemQuery lessThan(long position) {
        return new ItemQuery(originatorId, gt, gte, position, null, limit, ascending);
    }

    /** Positions less than or equal to {@code position}; replaces any upper bound. */
    public ItemQuery atMost(long position) {
        return new ItemQuery(originatorId, gt, gte, null, position, limit, ascending);
    }

    public ItemQuery limitedTo(int maxItems) {
        return new ItemQuery(originatorId, gt, gte, lt, lte, maxItems, ascending);
    }

    public ItemQuery unlimited() {
        return new ItemQuery(originatorId, gt, gte, lt, lte, null, ascending);
    }

    public ItemQuery inDescendingOrder() {
        return new ItemQuery(originatorId, gt, gte, lt, lte, limit, false);
    }

    public ItemQuery inAscendingOrder() {
        return new ItemQuery(originatorId, gt, gte, lt, lte, limit, true);
    }

    /** Smallest position the bounds admit. */
    public long lowerBound() {
        long lower = 0;
        if (gt != null) {
            lower = Math.max(lower, gt + 1);
        }
        if (gte != null) {
            lower = Math.max(lower, gte);
        }
        return lower;
    }

    /** Largest position the bounds admit, or {@link Long#MAX_VALUE} when unbounded. */
    public long upperBound() {
        long upper = Long.MAX_VALUE;
        if (lt != null) {
            upper = Math.min(upper, lt - 1);
        }
        if (lte != null) {
            upper = Math.min(upper, lte);
        }
        return upper;
    }

    /** Whether the bounds admit no position at all. */
    public boolean isEmptyRange() {
        return lowerBound() > upperBound();
    }

    /** Whether the bounds admit the given position. */
    public boolean includes(long position) {
        return position >= lowerBound() && position <= upperBound();
    }
}
