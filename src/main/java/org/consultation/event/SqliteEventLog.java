package org.consultation.event;

import org.consultation.errors.StorageException;
import org.consultation.util.ConversionUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only event log in SQLite, for external indexers.
 * Attributes are stored as a JSON object per row.
 */
public class SqliteEventLog implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(SqliteEventLog.class);

    private final String dbUrl;

    public SqliteEventLog(String dbFileName) {
        this.dbUrl = "jdbc:sqlite:" + dbFileName;
        initializeDatabase();
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl);
        try (Statement s = conn.createStatement()) {
            s.execute("PRAGMA journal_mode=WAL;");
            s.execute("PRAGMA busy_timeout=5000;");
        }
        return conn;
    }

    private void initializeDatabase() {
        String eventsTableSql = """
                CREATE TABLE IF NOT EXISTS events (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    event_type TEXT NOT NULL,
                    timestamp INTEGER NOT NULL,
                    attributes TEXT NOT NULL
                );""";

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(eventsTableSql);
        } catch (SQLException e) {
            log.error("[SqliteEventLog] Error initializing event log: {}", e.getMessage());
            throw new StorageException("Cannot initialize event log " + dbUrl, e);
        }
    }

    @Override
    public synchronized void publish(GovernanceEvent event) {
        String sql = "INSERT INTO events(event_type, timestamp, attributes) VALUES(?,?,?)";
        try (Connection conn = connect(); PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, event.getType().name());
            pstmt.setLong(2, event.getTimestamp());
            pstmt.setString(3, ConversionUtil.toJson(event.getAttributes()));
            pstmt.executeUpdate();
        } catch (SQLException e) {
            log.error("[SqliteEventLog] Error appending {}: {}", event.getType(), e.getMessage());
            throw new StorageException("Cannot append event", e);
        }
    }

    /**
     * All events in append order.
     */
    public List<GovernanceEvent> readAll() {
        return query("SELECT event_type, timestamp, attributes FROM events ORDER BY id", null);
    }

    /**
     * Events of one type in append order.
     */
    public List<GovernanceEvent> readByType(EventType type) {
        return query("SELECT event_type, timestamp, attributes FROM events WHERE event_type = ? ORDER BY id", type);
    }

    private List<GovernanceEvent> query(String sql, EventType type) {
        List<GovernanceEvent> events = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement pstmt = conn.prepareStatement(sql)) {
            if (type != null) {
                pstmt.setString(1, type.name());
            }
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    Map<String, String> attributes = ConversionUtil.jsonToMap(rs.getString("attributes"));
                    events.add(new GovernanceEvent(
                            EventType.valueOf(rs.getString("event_type")),
                            rs.getLong("timestamp"),
                            attributes == null ? Map.of() : attributes));
                }
            }
        } catch (SQLException e) {
            log.error("[SqliteEventLog] Error reading events: {}", e.getMessage());
            throw new StorageException("Cannot read event log", e);
        }
        return events;
    }
}
