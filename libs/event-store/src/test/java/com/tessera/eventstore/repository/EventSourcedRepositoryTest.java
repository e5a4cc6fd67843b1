package com.tessera.eventstore.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.DomainEvent;
import com.tessera.eventmodel.EntityNotFoundException;
import com.tessera.eventmodel.SequencedItem;
import com.tessera.eventmodel.SequencedItemMapper;
import com.tessera.eventmodel.Snapshot;
import com.tessera.eventstore.ActiveRecordStrategy;
import com.tessera.eventstore.BankAccount;
import com.tessera.eventstore.BankAccount.Closed;
import com.tessera.eventstore.BankAccount.Deposited;
import com.tessera.eventstore.BankAccount.Opened;
import com.tessera.eventstore.BankAccount.Withdrawn;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.InMemoryActiveRecordStrategy;
import com.tessera.eventstore.InterceptingActiveRecordStrategy;
import com.tessera.eventstore.ItemQuery;
import com.tessera.eventstore.snapshot.EventSourcedSnapshotStrategy;
import com.tessera.eventstore.snapshot.SnapshotPolicy;
import com.tessera.eventstore.snapshot.SnapshotStrategy;
import com.tessera.eventstore.snapshot.StaleSnapshotException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSourcedRepository")
class EventSourcedRepositoryTest {

    private static final String ID = "acc-1";

    private final SequencedItemMapper mapper = new SequencedItemMapper(BankAccount.topics());
    private final InterceptingActiveRecordStrategy records = new InterceptingActiveRecordStrategy();
    private final EventStore eventStore = new EventStore(records, mapper);

    private EventSourcedRepository<BankAccount> plainRepository() {
        return new EventSourcedRepository<>(eventStore, BankAccount.class, BankAccount::initial);
    }

    private static BankAccount openAndDeposit(EventSourcedRepository<BankAccount> repository, int deposits) {
        var changes = repository.create(ID).trigger((id, v) -> new Opened(id, v, "Ada"));
        for (int i = 0; i < deposits; i++) {
            changes.trigger((id, v) -> new Deposited(id, v, 100));
        }
        return repository.save(changes);
    }

    @Nested
    @DisplayName("without snapshots")
    class WithoutSnapshots {

        private final EventSourcedRepository<BankAccount> repository = plainRepository();

        @Test
        @DisplayName("saves a new entity and loads the same state back")
        void createAndLoad() {
            BankAccount saved = repository.save(repository.create(ID)
                    .trigger((id, v) -> new Opened(id, v, "Ada"))
                    .trigger((id, v) -> new Deposited(id, v, 500)));

            assertThat(saved).isEqualTo(new BankAccount(ID, 1, "Ada", 500, false));
            assertThat(repository.get(ID)).isEqualTo(saved);
            assertThat(repository.contains(ID)).isTrue();
        }

        @Test
        @DisplayName("appends edits after the loaded version")
        void editAndSave() {
            openAndDeposit(repository, 1);

            BankAccount loaded = repository.get(ID);
            repository.save(repository.edit(loaded).trigger((id, v) -> new Withdrawn(id, v, 40)));

            assertThat(repository.get(ID)).isEqualTo(new BankAccount(ID, 2, "Ada", 60, false));
        }

        @Test
        @DisplayName("passes a conflict from a stale edit to the caller unchanged")
        void staleEdit() {
            openAndDeposit(repository, 1);
            BankAccount first = repository.get(ID);
            BankAccount second = repository.get(ID);

            repository.save(repository.edit(first).trigger((id, v) -> new Deposited(id, v, 10)));
            var stale = repository.edit(second).trigger((id, v) -> new Withdrawn(id, v, 10));

            assertThatThrownBy(() -> repository.save(stale))
                    .isInstanceOf(ConcurrencyException.class);
            assertThat(repository.get(ID).balanceCents()).isEqualTo(110);
        }

        @Test
        @DisplayName("saving no changes writes nothing")
        void noChanges() {
            BankAccount saved = openAndDeposit(repository, 0);

            assertThat(repository.save(repository.edit(saved))).isSameAs(saved);
            assertThat(eventStore.getDomainEvents(ID)).hasSize(1);
        }

        @Test
        @DisplayName("reports an unknown entity as not found")
        void unknownEntity() {
            assertThatThrownBy(() -> repository.get("nobody"))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("nobody");
            assertThat(repository.find("nobody")).isEmpty();
            assertThat(repository.contains("nobody")).isFalse();
        }

        @Test
        @DisplayName("treats a discarded entity as absent but keeps its history")
        void discardedEntity() {
            BankAccount saved = openAndDeposit(repository, 1);
            repository.save(repository.edit(saved).trigger((id, v) -> new Closed(id, v, "moved abroad")));

            assertThatThrownBy(() -> repository.get(ID)).isInstanceOf(EntityNotFoundException.class);
            assertThat(repository.contains(ID)).isFalse();
            assertThat(repository.get(ID, 1L)).isEqualTo(new BankAccount(ID, 1, "Ada", 100, false));
        }

        @Test
        @DisplayName("loads the state as of an earlier version")
        void historicalState() {
            openAndDeposit(repository, 4);

            assertThat(repository.get(ID, 0L).balanceCents()).isZero();
            assertThat(repository.get(ID, 2L)).isEqualTo(new BankAccount(ID, 2, "Ada", 200, false));
            assertThat(repository.get(ID, 40L).version()).isEqualTo(4);
            assertThatThrownBy(() -> repository.get(ID, -1L)).isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        @DisplayName("refuses a snapshot policy without a snapshot strategy")
        void policyWithoutStrategy() {
            assertThatThrownBy(() -> new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial, null, SnapshotPolicy.every(5)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("with snapshots in a separate stream")
    class WithSeparateSnapshots {

        private final InMemoryActiveRecordStrategy snapshotRecords = new InMemoryActiveRecordStrategy();
        private final SnapshotStrategy snapshots =
                EventSourcedSnapshotStrategy.separateStream(snapshotRecords, mapper);

        @Test
        @DisplayName("replays only the events after the snapshot and reaches the same state")
        void replaysOnlyNewerEvents() {
            var repository = new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial, snapshots, SnapshotPolicy.never());
            BankAccount saved = openAndDeposit(repository, 9);
            repository.takeSnapshot(ID);
            var changes = repository.edit(saved);
            for (int i = 0; i < 3; i++) {
                changes.trigger((id, v) -> new Withdrawn(id, v, 5));
            }
            repository.save(changes);

            records.resetCounts();
            BankAccount fromSnapshot = repository.get(ID);
            int fetched = records.itemsFetched();

            assertThat(fetched).isEqualTo(3);
            assertThat(fromSnapshot).isEqualTo(plainRepository().get(ID));
            assertThat(fromSnapshot).isEqualTo(new BankAccount(ID, 12, "Ada", 885, false));
        }

        @Test
        @DisplayName("takes a snapshot when a save crosses the policy period")
        void automaticSnapshot() {
            var repository = new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial, snapshots, SnapshotPolicy.every(5));

            BankAccount saved = openAndDeposit(repository, 3);
            assertThat(snapshotRecords.getLastItem(ID)).isEmpty();

            saved = repository.save(repository.edit(saved).trigger((id, v) -> new Deposited(id, v, 100)));

            assertThat(saved.version()).isEqualTo(4);
            assertThat(snapshotRecords.getLastItem(ID)).map(item -> item.position()).contains(4L);
            assertThat(repository.get(ID)).isEqualTo(saved);
        }

        @Test
        @DisplayName("returns the committed entity when another writer snapshots a later version first")
        void automaticSnapshotOvertaken() {
            var racingRecords = new RacingSnapshotRecords();
            var repository = new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial,
                    EventSourcedSnapshotStrategy.separateStream(racingRecords, mapper),
                    SnapshotPolicy.every(2));
            openAndDeposit(repository, 0);
            BankAccount loaded = repository.get(ID);

            racingRecords.beforeNextRead(() -> {
                BankAccount current = repository.get(ID);
                repository.save(repository.edit(current)
                        .trigger((id, v) -> new Deposited(id, v, 100))
                        .trigger((id, v) -> new Deposited(id, v, 100)));
            });
            BankAccount saved = repository.save(
                    repository.edit(loaded).trigger((id, v) -> new Deposited(id, v, 100)));

            assertThat(saved).isEqualTo(new BankAccount(ID, 1, "Ada", 100, false));
            assertThat(racingRecords.getLastItem(ID)).map(SequencedItem::position).contains(3L);
            assertThat(repository.get(ID)).isEqualTo(new BankAccount(ID, 3, "Ada", 300, false));
            assertThat(eventStore.getDomainEvents(ID)).hasSize(4);
        }

        @Test
        @DisplayName("an explicit snapshot of an already covered version is rejected")
        void explicitSnapshotOfCoveredVersion() {
            var repository = new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial, snapshots, SnapshotPolicy.never());
            openAndDeposit(repository, 1);
            repository.takeSnapshot(ID);

            assertThatThrownBy(() -> repository.takeSnapshot(ID))
                    .isInstanceOf(StaleSnapshotException.class)
                    .hasMessageContaining("at version 1");
        }

        @Test
        @DisplayName("uses an older snapshot for a historical read")
        void historicalReadWithSnapshot() {
            var repository = new EventSourcedRepository<>(
                    eventStore, BankAccount.class, BankAccount::initial, snapshots, SnapshotPolicy.every(3));
            BankAccount saved = openAndDeposit(repository, 2);
            saved = repository.save(repository.edit(saved)
                    .trigger((id, v) -> new Deposited(id, v, 100))
                    .trigger((id, v) -> new Deposited(id, v, 100))
                    .trigger((id, v) -> new Deposited(id, v, 100)));

            assertThat(saved.version()).isEqualTo(5);
            assertThat(repository.get(ID, 3L)).isEqualTo(new BankAccount(ID, 3, "Ada", 300, false));
            assertThat(repository.get(ID, 1L)).isEqualTo(new BankAccount(ID, 1, "Ada", 100, false));
        }
    }

    @Nested
    @DisplayName("with snapshots in the entity's own chain")
    class WithSharedChainSnapshots {

        private final EventSourcedRepository<BankAccount> repository = new EventSourcedRepository<>(
                eventStore,
                BankAccount.class,
                BankAccount::initial,
                EventSourcedSnapshotStrategy.sharedChain(eventStore),
                SnapshotPolicy.every(3));

        @Test
        @DisplayName("returns the entity at the snapshot's position so the next edit follows it")
        void versionMovesPastSnapshot() {
            BankAccount saved = openAndDeposit(repository, 2);

            assertThat(saved.version()).isEqualTo(3);
            saved = repository.save(repository.edit(saved).trigger((id, v) -> new Deposited(id, v, 100)));

            assertThat(saved).isEqualTo(new BankAccount(ID, 4, "Ada", 300, false));
            assertThat(repository.get(ID)).isEqualTo(saved);
            List<DomainEvent> events = eventStore.getDomainEvents(ID);
            assertThat(events.get(3)).isInstanceOf(Snapshot.class);
            assertThat(eventStore.verifyChain(ID).position()).isEqualTo(4);
        }

        @Test
        @DisplayName("a plain repository over the same stream restores the embedded snapshot")
        void plainReplayOverSnapshots() {
            BankAccount saved = openAndDeposit(repository, 2);
            repository.save(repository.edit(saved).trigger((id, v) -> new Withdrawn(id, v, 50)));

            assertThat(plainRepository().get(ID)).isEqualTo(repository.get(ID));
        }

        @Test
        @DisplayName("reads before the snapshot replay from the start")
        void historicalBeforeSnapshot() {
            openAndDeposit(repository, 2);

            assertThat(repository.get(ID, 2L)).isEqualTo(new BankAccount(ID, 2, "Ada", 200, false));
            assertThat(repository.get(ID, 3L)).isEqualTo(new BankAccount(ID, 3, "Ada", 200, false));
        }
    }

    /** Snapshot backend that lets another writer act right before its next read. */
    private static final class RacingSnapshotRecords implements ActiveRecordStrategy {

        private final InMemoryActiveRecordStrategy delegate = new InMemoryActiveRecordStrategy();
        private Runnable beforeNextRead = () -> {};

        void beforeNextRead(Runnable action) {
            this.beforeNextRead = action;
        }

        @Override
        public void appendItems(List<SequencedItem> items) {
            delegate.appendItems(items);
        }

        @Override
        public List<SequencedItem> getItems(ItemQuery query) {
            Runnable action = beforeNextRead;
            beforeNextRead = () -> {};
            action.run();
            return delegate.getItems(query);
        }
    }
}
