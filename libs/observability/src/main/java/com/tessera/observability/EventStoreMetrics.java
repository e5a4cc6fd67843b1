package com.tessera.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.time.Duration;

/**
 * Micrometer meters for event store operations.
 *
 * <p>Every meter carries a {@code store} tag so several stores in one process (for example an
 * event store and a separate snapshot store) report separately.
 *
 * <ul>
 *   <li>{@value #EVENTS_APPENDED}: events successfully appended
 *   <li>{@value #APPEND_CONFLICTS}: appends rejected by optimistic concurrency control
 *   <li>{@value #INTEGRITY_FAILURES}: reads that hit a broken hash or chain link
 *   <li>{@value #EVENTS_READ}: events returned by reads
 *   <li>{@value #APPEND_DURATION}, {@value #READ_DURATION}: operation latency
 * </ul>
 */
public final class EventStoreMetrics {

    public static final String TAG_STORE = "store";

    public static final String EVENTS_APPENDED = "tessera.events.appended";
    public static final String APPEND_CONFLICTS = "tessera.append.conflicts";
    public static final String INTEGRITY_FAILURES = "tessera.integrity.failures";
    public static final String EVENTS_READ = "tessera.events.read";
    public static final String SNAPSHOTS_TAKEN = "tessera.snapshots.taken";
    public static final String APPEND_DURATION = "tessera.append.duration";
    public static final String READ_DURATION = "tessera.read.duration";

    private final MeterRegistry registry;
    private final String storeName;
    private final Counter eventsAppended;
    private final Counter appendConflicts;
    private final Counter integrityFailures;
    private final Counter eventsRead;
    private final Counter snapshotsTaken;
    private final Timer appendDuration;
    private final Timer readDuration;

    /**
     * Registers the store's meters.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param storeName logical store name used as the {@code store} tag
     */
    public EventStoreMetrics(MeterRegistry registry, String storeName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (storeName == null || storeName.isBlank()) {
            throw new IllegalArgumentException("storeName must not be null or blank");
        }
        this.registry = registry;
        this.storeName = storeName;
        this.eventsAppended = counter(EVENTS_APPENDED, "Events appended");
        this.appendConflicts = counter(APPEND_CONFLICTS, "Appends rejected as concurrent writes");
        this.integrityFailures = counter(INTEGRITY_FAILURES, "Hash or chain-link verification failures");
        this.eventsRead = counter(EVENTS_READ, "Events returned by reads");
        this.snapshotsTaken = counter(SNAPSHOTS_TAKEN, "Snapshots written");
        this.appendDuration = timer(APPEND_DURATION, "Time to append one batch");
        this.readDuration = timer(READ_DURATION, "Time to read and verify a range of events");
    }

    /** Metrics that are recorded nowhere, for stores built without a registry. */
    public static EventStoreMetrics noop() {
        return new EventStoreMetrics(new CompositeMeterRegistry(), "noop");
    }

    public void recordAppend(int events, Duration elapsed) {
        eventsAppended.increment(events);
        appendDuration.record(elapsed);
    }

    public void recordConflict() {
        appendConflicts.increment();
    }

    public void recordIntegrityFailure() {
        integrityFailures.increment();
    }

    public void recordRead(int events, Duration elapsed) {
        eventsRead.increment(events);
        readDuration.record(elapsed);
    }

    public void recordSnapshot() {
        snapshotsTaken.increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String storeName() {
        return storeName;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tags(Tags.of(TAG_STORE, storeName))
                .register(registry);
    }

    private Timer timer(String name, String description) {
        return Timer.builder(name)
                .description(description)
                .tags(Tags.of(TAG_STORE, storeName))
                .register(registry);
    }
}
