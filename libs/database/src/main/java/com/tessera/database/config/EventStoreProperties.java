package com.tessera.database.config;

import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.snapshot.SnapshotScheme;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for a JDBC-backed event store, bound from {@code tessera.eventstore.*}.
 *
 * <pre>{@code
 * tessera:
 *   eventstore:
 *     enabled: true
 *     page-size: 1000
 *     datasource:
 *       url: jdbc:postgresql://localhost:5432/ledger
 *       username: ledger
 *       password: ${LEDGER_DB_PASSWORD}
 *     items-table: sequenced_items
 *     snapshots-table: snapshots
 *     snapshot:
 *       scheme: SEPARATE_STREAM
 *       period: 100
 *     cipher:
 *       key: ${LEDGER_CIPHER_KEY}
 *     migrate-on-startup: true
 * }</pre>
 *
 * @param enabled whether {@link EventStoreConfiguration} is active
 * @param pageSize items fetched per query when reading (default 1000)
 * @param datasource connection settings
 * @param itemsTable table for event streams (default {@code sequenced_items})
 * @param snapshotsTable table for separate snapshot streams (default {@code snapshots})
 * @param snapshot snapshot layout and automatic period
 * @param cipher payload encryption; no key means plain JSON
 * @param migrateOnStartup run the schema migration when the context starts (default true)
 */
@Validated
@ConfigurationProperties(prefix = "tessera.eventstore")
public record EventStoreProperties(
        boolean enabled,
        @Positive Integer pageSize,
        @NotNull @Valid Datasource datasource,
        @Pattern(regexp = IDENTIFIER) String itemsTable,
        @Pattern(regexp = IDENTIFIER) String snapshotsTable,
        @Valid Snapshot snapshot,
        Cipher cipher,
        Boolean migrateOnStartup) {

    static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    /** Defaults for optional fields; runs before Bean Validation. */
    public EventStoreProperties {
        if (pageSize == null) {
            pageSize = EventStore.DEFAULT_PAGE_SIZE;
        }
        if (itemsTable == null || itemsTable.isBlank()) {
            itemsTable = "sequenced_items";
        }
        if (snapshotsTable == null || snapshotsTable.isBlank()) {
            snapshotsTable = "snapshots";
        }
        if (snapshot == null) {
            snapshot = new Snapshot(null, 0);
        }
        if (cipher == null) {
            cipher = new Cipher(null);
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = true;
        }
    }

    /**
     * @param url JDBC URL
     * @param username database user
     * @param password database password
     * @param maximumPoolSize connection pool size (default 10)
     */
    public record Datasource(@NotBlank String url, String username, String password, Integer maximumPoolSize) {

        public Datasource {
            if (maximumPoolSize == null || maximumPoolSize <= 0) {
                maximumPoolSize = 10;
            }
        }
    }

    /**
     * @param scheme where snapshots are stored (default {@link SnapshotScheme#SEPARATE_STREAM})
     * @param period snapshot every this many events; {@code 0} only on request
     */
    public record Snapshot(SnapshotScheme scheme, @PositiveOrZero int period) {

        public Snapshot {
            if (scheme == null) {
                scheme = SnapshotScheme.SEPARATE_STREAM;
            }
        }
    }

    /** @param key Base64 AES key of 128, 192 or 256 bits, or null to store plain JSON */
    public record Cipher(String key) {

        public boolean isEnabled() {
            return key != null && !key.isBlank();
        }
    }
}
