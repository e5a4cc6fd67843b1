package com.tessera.database.migration;

import com.tessera.database.jdbc.TableName;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and upgrades the item and snapshot tables with Flyway.
 *
 * <p>Table names reach the scripts as the {@code items_table} and {@code snapshots_table}
 * placeholders, so several stores can live side by side in one database. Each store keeps its own
 * history table, named after its items table; a schema that already holds other tables is
 * baselined below the first script so every script still runs.
 *
 * <p>A plain object: construct it in tests without a Spring context. {@link
 * com.tessera.database.config.EventStoreConfiguration} wires it for applications.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String LOCATION = "classpath:db/migration/tessera";

    /**
     * One migration script and its state in the database.
     *
     * @param version migration version (e.g., "1")
     * @param description migration description (e.g., "sequenced items")
     * @param state Flyway state (e.g., "Success", "Pending")
     * @param installedOn when the script ran, or null if it has not
     */
    public record MigrationInfo(String version, String description, String state, String installedOn) {}

    /**
     * Where the schema stands.
     *
     * @param itemsTable table holding event streams
     * @param snapshotsTable table holding snapshot streams
     * @param appliedMigrations number of scripts applied
     * @param pendingMigrations number of scripts waiting
     * @param currentVersion current schema version, or null before the first migration
     */
    public record SchemaStatus(
            String itemsTable,
            String snapshotsTable,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion) {

        public boolean isUpToDate() {
            return pendingMigrations == 0 && currentVersion != null;
        }
    }

    private final Flyway flyway;
    private final String itemsTable;
    private final String snapshotsTable;

    public SchemaMigrator(DataSource dataSource, String itemsTable, String snapshotsTable) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.itemsTable = TableName.require(itemsTable);
        this.snapshotsTable = TableName.require(snapshotsTable);
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .table(this.itemsTable + "_schema_history")
                .placeholders(Map.of(
                        "items_table", this.itemsTable,
                        "snapshots_table", this.snapshotsTable))
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load();
    }

    /** Applies pending scripts and returns the resulting status. */
    public SchemaStatus migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Migrated schema for tables {} and {}: {} script(s) applied, now at version {}",
                itemsTable, snapshotsTable, result.migrationsExecuted, result.targetSchemaVersion);
        return status();
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        String currentVersion = info.current() != null && info.current().getVersion() != null
                ? info.current().getVersion().getVersion()
                : null;
        return new SchemaStatus(
                itemsTable, snapshotsTable, info.applied().length, info.pending().length, currentVersion);
    }

    /** Every known script, applied or not, in version order. */
    public List<MigrationInfo> history() {
        return Arrays.stream(flyway.info().all())
                .map(m -> new MigrationInfo(
                        m.getVersion() != null ? m.getVersion().getVersion() : null,
                        m.getDescription(),
                        m.getState().getDisplayName(),
                        m.getInstalledOn() != null ? m.getInstalledOn().toInstant().toString() : null))
                .toList();
    }

    public String itemsTable() {
        return itemsTable;
    }

    public String snapshotsTable() {
        return snapshotsTable;
    }
}
