package org.consultation.db;

import org.consultation.errors.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * {@link KeyValueStore} on a single SQLite table.
 * <p>
 * Readers can run concurrently; units of work are exclusive and each maps to one
 * JDBC transaction. Uses WAL mode and a busy timeout.
 */
public class SqliteKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteKeyValueStore.class);

    private final String dbUrl;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock(true); // fair lock

    public SqliteKeyValueStore(String dbFileName) {
        this.dbUrl = "jdbc:sqlite:" + dbFileName;
        initializeDatabase();
    }

    // --- Connection management with concurrency-friendly PRAGMAs ---
    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement s = conn.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA synchronous=NORMAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return conn;
    }

    private void initializeDatabase() {
        String stateStoreSql = """
                CREATE TABLE IF NOT EXISTS state_store (
                    key TEXT PRIMARY KEY,
                    value TEXT NOT NULL
                );""";

        rwLock.writeLock().lock();
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(stateStoreSql);
            log.info("[SqliteKeyValueStore] Initialized {}", dbUrl);
        } catch (SQLException e) {
            throw wrap("initialize " + dbUrl, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public <T> T read(Function<StoreTransaction, T> body) {
        rwLock.readLock().lock();
        try (Connection conn = connect()) {
            return body.apply(new JdbcTransaction(conn, true));
        } catch (SQLException e) {
            throw wrap("read", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public <T> T inTransaction(Function<StoreTransaction, T> body) {
        rwLock.writeLock().lock();
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                T result = body.apply(new JdbcTransaction(conn, false));
                conn.commit();
                return result;
            } catch (RuntimeException | SQLException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw wrap("transaction", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        // connections are opened per unit of work
    }

    /**
     * Rolls back after {@code cause}; a failing rollback is attached to {@code cause}
     * so the caller still sees the original failure.
     */
    static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            log.error("[SqliteKeyValueStore] Rollback failed: {}", rollbackFailure.getMessage());
            cause.addSuppressed(rollbackFailure);
        }
    }

        private StorageException wrap(String what, SQLException e) {
        log.error("[SqliteKeyValueStore] {} failed: {}", what, e.getMessage());
        return new StorageException("Storage failure during " + what, e);
    }

    private final class JdbcTransaction implements StoreTransaction {

        private final Connection conn;
        private final boolean readOnly;

        JdbcTransaction(Connection conn, boolean readOnly) {
            this.conn = conn;
            this.readOnly = readOnly;
        }

        @Override
        public String get(String key) {
            try (PreparedStatement pstmt = conn.prepareStatement("SELECT value FROM state_store WHERE key = ?")) {
                pstmt.setString(1, key);
                try (ResultSet rs = pstmt.executeQuery()) {
                    return rs.next() ? rs.getString("value") : null;
                }
            } catch (SQLException e) {
                throw wrap("get " + key, e);
            }
        }

        @Override
        public void put(String key, String value) {
            checkWritable();
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "INSERT INTO state_store (key, value) VALUES (?, ?) " +
                            "ON CONFLICT(key) DO UPDATE SET value=excluded.value")) {
                pstmt.setString(1, key);
                pstmt.setString(2, value);
                pstmt.executeUpdate();
            } catch (SQLException e) {
                throw wrap("put " + key, e);
            }
        }

        @Override
        public void delete(String key) {
            checkWritable();
            try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM state_store WHERE key = ?")) {
                pstmt.setString(1, key);
                pstmt.executeUpdate();
            } catch (SQLException e) {
                throw wrap("delete " + key, e);
            }
        }

        @Override
        public SortedMap<String, String> scan(String prefix) {
            SortedMap<String, String> out = new TreeMap<>();
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "SELECT key, value FROM state_store WHERE key >= ? AND key < ? ORDER BY key")) {
                pstmt.setString(1, prefix);
                pstmt.setString(2, prefix + Character.MAX_VALUE);
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        out.put(rs.getString("key"), rs.getString("value"));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw wrap("scan " + prefix, e);
            }
        }

        private void checkWritable() {
            if (readOnly) {
                throw new IllegalStateException("Store opened read-only for this unit of work");
            }
        }
    }
}
