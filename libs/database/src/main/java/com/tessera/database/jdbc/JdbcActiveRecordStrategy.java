package com.tessera.database.jdbc;

import com.tessera.eventmodel.ConcurrencyException;
import com.tessera.eventmodel.DatastoreException;
import com.tessera.eventmodel.SequencedItem;
import com.tessera.eventstore.ActiveRecordStrategy;
import com.tessera.eventstore.ItemQuery;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores sequenced items in a relational table keyed by (originator_id, position).
 *
 * <p>A batch is inserted in one transaction. The primary key rejects any position that is already
 * taken; that rejection rolls the whole batch back and is reported as {@link
 * ConcurrencyException}. Every other {@link SQLException} becomes a {@link DatastoreException}.
 *
 * <p>The table layout is created by {@code db/migration/tessera/V1__sequenced_items.sql}.
 */
public class JdbcActiveRecordStrategy implements ActiveRecordStrategy {

    private static final Logger log = LoggerFactory.getLogger(JdbcActiveRecordStrategy.class);

    private static final String UNIQUE_VIOLATION = "23505";

    /** Integrity violations that are not about a duplicate key. */
    private static final Set<String> OTHER_INTEGRITY_VIOLATIONS = Set.of("23502", "23503", "23514");

    private static final String COLUMNS =
            "originator_id, position, topic, state, originator_hash, event_hash";

    private final DataSource dataSource;
    private final String table;
    private final String insertSql;
    private final String selectSql;

    public JdbcActiveRecordStrategy(DataSource dataSource, String table) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
        this.table = TableName.require(table);
        this.insertSql = "INSERT INTO " + this.table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)";
        this.selectSql = "SELECT " + COLUMNS + " FROM " + this.table
                + " WHERE originator_id = ? AND position >= ? AND position <= ?";
    }

    @Override
    public void appendItems(List<SequencedItem> items) {
        String originatorId = ActiveRecordStrategy.checkBatch(items);
        long firstPosition = items.get(0).position();

        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            SQLException failure = null;
            try (PreparedStatement insert = connection.prepareStatement(insertSql)) {
                for (SequencedItem item : items) {
                    insert.setString(1, item.originatorId());
                    insert.setLong(2, item.position());
                    insert.setString(3, item.topic());
                    insert.setString(4, item.state());
                    insert.setString(5, item.originatorHash());
                    insert.setString(6, item.eventHash());
                    insert.addBatch();
                }
                insert.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                rollback(connection, e);
                failure = e;
            }
            restoreAutoCommit(connection, autoCommit, failure);
            if (failure != null) {
                throw failure;
            }
        } catch (SQLException e) {
            if (isDuplicateKey(e)) {
                throw new ConcurrencyException(originatorId, firstPosition - 1, e);
            }
            throw new DatastoreException(
                    "Could not append %d item(s) to '%s' in table %s".formatted(items.size(), originatorId, table), e);
        }
    }

    @Override
    public List<SequencedItem> getItems(ItemQuery query) {
        if (query.isEmptyRange()) {
            return List.of();
        }
        String sql = selectSql
                + (query.ascending() ? " ORDER BY position ASC" : " ORDER BY position DESC")
                + (query.limit() != null ? " LIMIT ?" : "");

        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = connection.prepareStatement(sql)) {
            select.setString(1, query.originatorId());
            select.setLong(2, query.lowerBound());
            select.setLong(3, query.upperBound());
            if (query.limit() != null) {
                select.setInt(4, query.limit());
            }
            try (ResultSet rows = select.executeQuery()) {
                var items = new ArrayList<SequencedItem>();
                while (rows.next()) {
                    items.add(new SequencedItem(
                            rows.getString("originator_id"),
                            rows.getLong("position"),
                            rows.getString("topic"),
                            rows.getString("state"),
                            rows.getString("originator_hash"),
                            rows.getString("event_hash")));
                }
                return List.copyOf(items);
            }
        } catch (SQLException e) {
            throw new DatastoreException(
                    "Could not read items of '%s' from table %s".formatted(query.originatorId(), table), e);
        }
    }

    public String table() {
        return table;
    }

    private static void rollback(Connection connection, SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed after: {}", cause.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    /** A failed restore never replaces the outcome of the batch itself. */
    private void restoreAutoCommit(Connection connection, boolean autoCommit, SQLException failure) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                log.warn("Could not restore auto-commit on a connection to table {}", table, e);
            }
        }
    }

    /** Looks through causes and chained exceptions, since batch failures wrap the statement's own error. */
    static boolean isDuplicateKey(SQLException failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                for (SQLException e = sql; e != null; e = e.getNextException()) {
                    if (isDuplicateKeyState(e)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static boolean isDuplicateKeyState(SQLException e) {
        String state = e.getSQLState();
        if (UNIQUE_VIOLATION.equals(state)) {
            return true;
        }
        return e instanceof SQLIntegrityConstraintViolationException
                && (state == null || !OTHER_INTEGRITY_VIOLATIONS.contains(state));
    }
}
