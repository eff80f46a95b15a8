package org.prefixwatch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed append-only log of snapshots, change-sets and tickets.
 *
 * <p>All access goes through a single connection guarded by one lock, so a unit of work passed to
 * {@link #inTransaction(StoreWork)} is linearizable with respect to every other caller. The store
 * never retries; SQL failures surface as {@link StorageException}.
 */
public final class SnapshotStore implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final List<String> SCHEMA = List.of("""
            CREATE TABLE IF NOT EXISTS snapshots (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                target TEXT NOT NULL,
                target_type TEXT NOT NULL,
                observed_at INTEGER NOT NULL,
                sources TEXT NOT NULL,
                ipv4_prefixes TEXT NOT NULL,
                ipv6_prefixes TEXT NOT NULL,
                content_hash TEXT NOT NULL
            )""", """
            CREATE TABLE IF NOT EXISTS diffs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                new_snapshot_id INTEGER NOT NULL REFERENCES snapshots(id),
                old_snapshot_id INTEGER REFERENCES snapshots(id),
                target TEXT NOT NULL,
                added_v4 TEXT NOT NULL,
                removed_v4 TEXT NOT NULL,
                added_v6 TEXT NOT NULL,
                removed_v6 TEXT NOT NULL,
                diff_hash TEXT NOT NULL,
                has_changes INTEGER NOT NULL,
                created_at INTEGER NOT NULL
            )""", """
            CREATE TABLE IF NOT EXISTS tickets (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                diff_id INTEGER NOT NULL REFERENCES diffs(id),
                target TEXT NOT NULL,
                external_ticket_id TEXT,
                status TEXT NOT NULL,
                request_payload TEXT NOT NULL,
                response_payload TEXT,
                created_at INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_snapshots_target_ts ON snapshots(target, observed_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_snapshots_hash ON snapshots(content_hash)",
            "CREATE INDEX IF NOT EXISTS idx_diffs_hash ON diffs(diff_hash)",
            "CREATE INDEX IF NOT EXISTS idx_diffs_target ON diffs(target, created_at DESC)",
            "CREATE INDEX IF NOT EXISTS idx_tickets_diff ON tickets(diff_id)");

    private final Connection connection;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private int transactionDepth;

    private SnapshotStore(Connection connection, ObjectMapper mapper, Clock clock) {
        this.connection = connection;
        this.mapper = mapper;
        this.clock = clock;
    }

    public static SnapshotStore open(Path databaseFile, ObjectMapper mapper, Clock clock) {
        try {
            final var parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            return connect("jdbc:sqlite:" + databaseFile, mapper, clock);
        } catch (IOException ex) {
            throw new StorageException("Unable to create database directory for " + databaseFile, ex);
        }
    }

    public static SnapshotStore inMemory(ObjectMapper mapper, Clock clock) {
        return connect("jdbc:sqlite::memory:", mapper, clock);
    }

    private static SnapshotStore connect(String url, ObjectMapper mapper, Clock clock) {
        try {
            final var connection = DriverManager.getConnection(url);
            try (var statement = connection.createStatement()) {
                statement.execute("PRAGMA foreign_keys = ON");
            }
            return new SnapshotStore(connection, mapper, clock);
        } catch (SQLException ex) {
            throw new StorageException("Unable to open database " + url, ex);
        }
    }

    public void migrate() {
        withConnection(conn -> {
            try (var statement = conn.createStatement()) {
                for (final var ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            return null;
        });
    }

    /**
     * Runs {@code work} as one atomic unit: either every write inside it commits or none is visible.
     * Nested calls join the outer transaction.
     */
    public <T> T inTransaction(StoreWork<T> work) {
        lock.lock();
        try {
            if (transactionDepth > 0) {
                transactionDepth++;
                try {
                    return work.run(this);
                } finally {
                    transactionDepth--;
                }
            }
            begin();
            transactionDepth = 1;
            try {
                final var result = work.run(this);
                commit();
                return result;
            } catch (RuntimeException | Error ex) {
                rollback(ex);
                throw ex;
            } finally {
                transactionDepth = 0;
                restoreAutoCommit();
            }
        } finally {
            lock.unlock();
        }
    }

    // Snapshots

    public long saveSnapshot(String target, TargetType targetType, List<String> sources,
                             Collection<String> ipv4Prefixes, Collection<String> ipv6Prefixes) {
        final var sortedV4 = ContentHashes.sorted(ipv4Prefixes);
        final var sortedV6 = ContentHashes.sorted(ipv6Prefixes);
        final var contentHash = ContentHashes.snapshotHash(sortedV4, sortedV6);
        final var observedAt = now();
        return withConnection(conn -> {
            try (var statement = conn.prepareStatement("""
                    INSERT INTO snapshots (target, target_type, observed_at, sources, ipv4_prefixes, ipv6_prefixes,
                                           content_hash)
                    VALUES (?, ?, ?, ?, ?, ?, ?)""")) {
                statement.setString(1, target);
                statement.setString(2, targetType.dbValue());
                statement.setLong(3, observedAt);
                statement.setString(4, toJson(sources == null ? List.of() : sources));
                statement.setString(5, toJson(sortedV4));
                statement.setString(6, toJson(sortedV6));
                statement.setString(7, contentHash);
                statement.executeUpdate();
            }
            final var id = lastInsertId(conn);
            LOGGER.debug("Saved snapshot {} for {} ({} IPv4, {} IPv6, hash {})",
                    id, target, sortedV4.size(), sortedV6.size(), contentHash);
            return id;
        });
    }

    public Optional<Snapshot> getLatestSnapshot(String target) {
        return querySnapshot("""
                SELECT * FROM snapshots WHERE target = ?
                ORDER BY observed_at DESC, id DESC LIMIT 1""", target);
    }

    public Optional<Snapshot> getSnapshotBefore(String target, Instant cutoff) {
        return querySnapshot("""
                SELECT * FROM snapshots WHERE target = ? AND observed_at < ?
                ORDER BY observed_at DESC, id DESC LIMIT 1""", target, cutoff.getEpochSecond());
    }

    public List<Snapshot> getSnapshotHistory(String target, int limit) {
        return withConnection(conn -> {
            try (var statement = conn.prepareStatement("""
                    SELECT * FROM snapshots WHERE target = ?
                    ORDER BY observed_at DESC, id DESC LIMIT ?""")) {
                statement.setString(1, target);
                statement.setInt(2, Math.max(0, limit));
                try (var rows = statement.executeQuery()) {
                    final var snapshots = new ArrayList<Snapshot>();
                    while (rows.next()) snapshots.add(toSnapshot(rows));
                    return List.copyOf(snapshots);
                }
            }
        });
    }

    public Optional<Snapshot> getSnapshotById(long snapshotId) {
        return querySnapshot("SELECT * FROM snapshots WHERE id = ?", snapshotId);
    }

    // Change-sets

    public long saveDiff(long newSnapshotId, Long oldSnapshotId, String target, Collection<String> addedV4,
                         Collection<String> removedV4, Collection<String> addedV6, Collection<String> removedV6,
                         String diffHash) {
        final var sortedAddedV4 = ContentHashes.sorted(addedV4);
        final var sortedRemovedV4 = ContentHashes.sorted(removedV4);
        final var sortedAddedV6 = ContentHashes.sorted(addedV6);
        final var sortedRemovedV6 = ContentHashes.sorted(removedV6);
        final var hasChanges = !sortedAddedV4.isEmpty() || !sortedRemovedV4.isEmpty()
                || !sortedAddedV6.isEmpty() || !sortedRemovedV6.isEmpty();
        final var createdAt = now();
        return withConnection(conn -> {
            try (var statement = conn.prepareStatement("""
                    INSERT INTO diffs (new_snapshot_id, old_snapshot_id, target, added_v4, removed_v4, added_v6,
                                       removed_v6, diff_hash, has_changes, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""")) {
                statement.setLong(1, newSnapshotId);
                if (oldSnapshotId == null) statement.setNull(2, Types.INTEGER);
                else statement.setLong(2, oldSnapshotId);
                statement.setString(3, target);
                statement.setString(4, toJson(sortedAddedV4));
                statement.setString(5, toJson(sortedRemovedV4));
                statement.setString(6, toJson(sortedAddedV6));
                statement.setString(7, toJson(sortedRemovedV6));
                statement.setString(8, diffHash);
                statement.setInt(9, hasChanges ? 1 : 0);
                statement.setLong(10, createdAt);
                statement.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    public Optional<ChangeSet> getDiffByHash(String diffHash) {
        return queryDiff("SELECT * FROM diffs WHERE diff_hash = ? ORDER BY id DESC LIMIT 1", diffHash);
    }

    public Optional<ChangeSet> getDiffById(long diffId) {
        return queryDiff("SELECT * FROM diffs WHERE id = ?", diffId);
    }

    public Optional<ChangeSet> getLatestDiff(String target) {
        return queryDiff("SELECT * FROM diffs WHERE target = ? ORDER BY created_at DESC, id DESC LIMIT 1", target);
    }

    // Tickets

    public long saveTicket(long diffId, String target, TicketStatus status, JsonNode requestPayload) {
        final var createdAt = now();
        return withConnection(conn -> {
            try (var statement = conn.prepareStatement("""
                    INSERT INTO tickets (diff_id, target, status, request_payload, created_at)
                    VALUES (?, ?, ?, ?, ?)""")) {
                statement.setLong(1, diffId);
                statement.setString(2, target);
                statement.setString(3, status.dbValue());
                statement.setString(4, toJson(requestPayload));
                statement.setLong(5, createdAt);
                statement.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    public void updateTicketStatus(long ticketId, TicketStatus status, JsonNode responsePayload,
                                   String externalTicketId) {
        withConnection(conn -> {
            try (var statement = conn.prepareStatement("""
                    UPDATE tickets
                    SET status = ?, response_payload = ?, external_ticket_id = COALESCE(?, external_ticket_id)
                    WHERE id = ?""")) {
                statement.setString(1, status.dbValue());
                if (responsePayload == null) statement.setNull(2, Types.VARCHAR);
                else statement.setString(2, toJson(responsePayload));
                if (externalTicketId == null) statement.setNull(3, Types.VARCHAR);
                else statement.setString(3, externalTicketId);
                statement.setLong(4, ticketId);
                if (statement.executeUpdate() == 0) {
                    throw new SQLException("No ticket with id " + ticketId);
                }
            }
            return null;
        });
    }

    public Optional<Ticket> getTicketForDiff(long diffId) {
        return queryTicket("SELECT * FROM tickets WHERE diff_id = ? ORDER BY created_at DESC, id DESC LIMIT 1",
                diffId);
    }

    /**
     * A {@code created} or {@code duplicate} ticket for any change-set with this hash. The hash covers
     * the target and the change itself, not the snapshots that produced it.
     */
    public Optional<Ticket> findSuccessfulTicket(String diffHash) {
        return queryTicket("""
                SELECT t.* FROM tickets t JOIN diffs d ON d.id = t.diff_id
                WHERE d.diff_hash = ? AND t.status IN (?, ?)
                ORDER BY t.created_at DESC, t.id DESC LIMIT 1""",
                diffHash, TicketStatus.CREATED.dbValue(), TicketStatus.DUPLICATE.dbValue());
    }

    public Optional<Ticket> getTicketById(long ticketId) {
        return queryTicket("SELECT * FROM tickets WHERE id = ?", ticketId);
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new StorageException("Failed to close database connection", ex);
        } finally {
            lock.unlock();
        }
    }

    private Optional<Snapshot> querySnapshot(String sql, Object... params) {
        return queryOne(sql, this::toSnapshot, params);
    }

    private Optional<ChangeSet> queryDiff(String sql, Object... params) {
        return queryOne(sql, this::toChangeSet, params);
    }

    private Optional<Ticket> queryTicket(String sql, Object... params) {
        return queryOne(sql, this::toTicket, params);
    }

    private <T> Optional<T> queryOne(String sql, RowMapper<T> rowMapper, Object... params) {
        return withConnection(conn -> {
            try (var statement = conn.prepareStatement(sql)) {
                bind(statement, params);
                try (var rows = statement.executeQuery()) {
                    return rows.next() ? Optional.of(rowMapper.map(rows)) : Optional.<T>empty();
                }
            }
        });
    }

    private static void bind(PreparedStatement statement, Object... params) throws SQLException {
        for (var i = 0; i < params.length; i++) {
            statement.setObject(i + 1, params[i]);
        }
    }

    private Snapshot toSnapshot(ResultSet rows) throws SQLException {
        return new Snapshot(rows.getLong("id"),
                rows.getString("target"),
                TargetType.fromDb(rows.getString("target_type")),
                Instant.ofEpochSecond(rows.getLong("observed_at")),
                stringList(rows.getString("sources")),
                stringList(rows.getString("ipv4_prefixes")),
                stringList(rows.getString("ipv6_prefixes")),
                rows.getString("content_hash"));
    }

    private ChangeSet toChangeSet(ResultSet rows) throws SQLException {
        final var oldId = rows.getLong("old_snapshot_id");
        final Long baselineId = rows.wasNull() ? null : oldId;
        return new ChangeSet(rows.getLong("id"),
                rows.getString("target"),
                rows.getLong("new_snapshot_id"),
                baselineId,
                stringList(rows.getString("added_v4")),
                stringList(rows.getString("removed_v4")),
                stringList(rows.getString("added_v6")),
                stringList(rows.getString("removed_v6")),
                rows.getInt("has_changes") != 0,
                rows.getString("diff_hash"),
                Instant.ofEpochSecond(rows.getLong("created_at")));
    }

    private Ticket toTicket(ResultSet rows) throws SQLException {
        final var response = rows.getString("response_payload");
        return new Ticket(rows.getLong("id"),
                rows.getLong("diff_id"),
                rows.getString("target"),
                rows.getString("external_ticket_id"),
                TicketStatus.fromDb(rows.getString("status")),
                tree(rows.getString("request_payload")),
                response == null ? null : tree(response),
                Instant.ofEpochSecond(rows.getLong("created_at")));
    }

    private <T> T withConnection(SqlWork<T> work) {
        lock.lock();
        try {
            return work.run(connection);
        } catch (SQLException ex) {
            throw new StorageException("Database operation failed: " + ex.getMessage(), ex);
        } finally {
            lock.unlock();
        }
    }

    private void begin() {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException ex) {
            throw new StorageException("Unable to begin transaction", ex);
        }
    }

    private void commit() {
        try {
            connection.commit();
        } catch (SQLException ex) {
            throw new StorageException("Unable to commit transaction", ex);
        }
    }

    private void rollback(Throwable cause) {
        try {
            connection.rollback();
            LOGGER.warn("Rolled back transaction after {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
        } catch (SQLException ex) {
            cause.addSuppressed(ex);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException ex) {
            throw new StorageException("Unable to restore auto-commit", ex);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (var statement = conn.createStatement();
             var rows = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rows.next()) throw new SQLException("No row id after insert");
            return rows.getLong(1);
        }
    }

    private String toJson(Object value) throws SQLException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Unable to serialize column value", ex);
        }
    }

    private List<String> stringList(String json) throws SQLException {
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt list column: " + json, ex);
        }
    }

    private JsonNode tree(String json) throws SQLException {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt payload column", ex);
        }
    }

    @FunctionalInterface
    public interface StoreWork<T> {
        T run(SnapshotStore store);
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rows) throws SQLException;
    }
}
