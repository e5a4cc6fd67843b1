package com.tessera.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.database.H2Databases;
import com.tessera.database.jdbc.JdbcActiveRecordStrategy;
import com.tessera.eventmodel.SequencedItem;
import com.tessera.eventstore.ItemQuery;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaMigrator")
class SchemaMigratorTest {

    private final DataSource dataSource = H2Databases.newDataSource();

    @Test
    @DisplayName("reports the script as pending before the first migration")
    void pendingBeforeMigration() {
        var migrator = new SchemaMigrator(dataSource, "sequenced_items", "snapshots");

        SchemaMigrator.SchemaStatus status = migrator.status();

        assertThat(status.pendingMigrations()).isEqualTo(1);
        assertThat(status.currentVersion()).isNull();
        assertThat(status.isUpToDate()).isFalse();
    }

    @Test
    @DisplayName("applies the script once and is idempotent afterwards")
    void migratesOnce() {
        var migrator = new SchemaMigrator(dataSource, "sequenced_items", "snapshots");

        SchemaMigrator.SchemaStatus first = migrator.migrate();
        SchemaMigrator.SchemaStatus second = migrator.migrate();

        assertThat(first.isUpToDate()).isTrue();
        assertThat(first.currentVersion()).isEqualTo("1");
        assertThat(second).isEqualTo(first);
        assertThat(migrator.history())
                .singleElement()
                .satisfies(info -> {
                    assertThat(info.version()).isEqualTo("1");
                    assertThat(info.description()).isEqualTo("sequenced items");
                    assertThat(info.installedOn()).isNotNull();
                });
    }

    @Test
    @DisplayName("creates tables under the configured names, side by side with another store")
    void customTableNames() {
        new SchemaMigrator(dataSource, "sequenced_items", "snapshots").migrate();
        new SchemaMigrator(dataSource, "ledger_items", "ledger_snapshots").migrate();

        var ledger = new JdbcActiveRecordStrategy(dataSource, "ledger_items");
        var ledgerSnapshots = new JdbcActiveRecordStrategy(dataSource, "ledger_snapshots");
        var item = new SequencedItem("l-1", 0, "Topic", "{}", "", "h0");
        ledger.appendItems(List.of(item));
        ledgerSnapshots.appendItems(List.of(item));

        assertThat(ledger.getItems(ItemQuery.forOriginator("l-1"))).containsExactly(item);
        assertThat(new JdbcActiveRecordStrategy(dataSource, "sequenced_items")
                .getItems(ItemQuery.forOriginator("l-1"))).isEmpty();
    }

    @Test
    @DisplayName("rejects unsafe table names before touching the database")
    void unsafeNames() {
        assertThatThrownBy(() -> new SchemaMigrator(dataSource, "items;--", "snapshots"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SchemaMigrator(null, "items", "snapshots"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
