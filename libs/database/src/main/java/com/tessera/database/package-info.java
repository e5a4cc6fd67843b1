/**
 * Relational backend for the Tessera event store.
 *
 * <ul>
 *   <li>{@link com.tessera.database.jdbc.JdbcActiveRecordStrategy}: items in a table keyed by
 *       (originator_id, position)
 *   <li>{@link com.tessera.database.migration.SchemaMigrator}: Flyway scripts under {@code
 *       db/migration/tessera}
 *   <li>{@link com.tessera.database.config.EventStoreConfiguration}: Spring wiring from {@code
 *       tessera.eventstore.*}
 * </ul>
 */
package com.tessera.database;
