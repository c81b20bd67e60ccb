package com.openforge.mnemosyne.session;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * SQLite-backed durable counters.
 *
 * Schema:
 * ┌────────────────────────┬────────────────────────────────────────────────┐
 * │ Table                  │ Columns                                        │
 * ├────────────────────────┼────────────────────────────────────────────────┤
 * │ message_counts         │ session_id TEXT PK, count INTEGER ≥ 0          │
 * │ session_summary_times  │ session_id TEXT PK, last_summary_timestamp REAL│
 * └────────────────────────┴────────────────────────────────────────────────┘
 *
 * The two tables change at different moments (count per turn, timestamp per
 * summarization), so they stay separate.
 *
 * One JDBC connection is shared and every statement runs under {@code lock}.
 * Failures are logged and reported through return values; nothing is thrown
 * to callers after startup.
 */
@Slf4j
@Component
@EnableConfigurationProperties(CounterStoreProperties.class)
public class MessageCounterStore {

    private final String dbPath;
    private final Object lock = new Object();
    private volatile Connection connection;

    @Autowired
    public MessageCounterStore(CounterStoreProperties props) {
        this(props.dbPath());
    }

    /** Constructor for testing with explicit db path. */
    public MessageCounterStore(String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() {
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            log.error("[Counter] Failed to create directory for {}", dbPath, e);
        }
        synchronized (lock) {
            try {
                connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
                try (var stmt = connection.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL");
                    stmt.execute("PRAGMA busy_timeout=5000");
                    stmt.execute("""
                        CREATE TABLE IF NOT EXISTS message_counts (
                            session_id TEXT PRIMARY KEY,
                            count INTEGER NOT NULL DEFAULT 0
                        )
                        """);
                    stmt.execute("""
                        CREATE TABLE IF NOT EXISTS session_summary_times (
                            session_id TEXT PRIMARY KEY,
                            last_summary_timestamp REAL NOT NULL
                        )
                        """);
                }
                log.info("[Counter] Message counter store initialized at: {}", dbPath);
            } catch (SQLException e) {
                log.error("[Counter] Failed to initialize SQLite counter store at {} — counters DISABLED", dbPath, e);
                closeQuietly();
            }
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            closeQuietly();
        }
    }

    public boolean isAvailable() {
        return connection != null;
    }

    public String dbPath() {
        return dbPath;
    }

    // ── Message counts ───────────────────────────────────────────────────────

    /** Stored count, 0 when the session has no row or the read failed. */
    public int getCount(String sessionId) {
        return readCount(sessionId).orElse(0);
    }

    /** Stored count; empty only when the read itself failed. */
    public OptionalInt readCount(String sessionId) {
        synchronized (lock) {
            if (connection == null) return OptionalInt.empty();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT count FROM message_counts WHERE session_id = ?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return OptionalInt.of(rs.next() ? rs.getInt(1) : 0);
                }
            } catch (SQLException e) {
                log.error("[Counter] Failed to read count for session {}", sessionId, e);
                return OptionalInt.empty();
            }
        }
    }

    public boolean incrementCount(String sessionId) {
        return update(sessionId, """
                INSERT INTO message_counts (session_id, count) VALUES (?, 1)
                ON CONFLICT(session_id) DO UPDATE SET count = count + 1
                """, ps -> {}, "increment count");
    }

    public boolean resetCount(String sessionId) {
        return setCount(sessionId, 0);
    }

    public boolean setCount(String sessionId, int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        return update(sessionId, """
                INSERT INTO message_counts (session_id, count) VALUES (?, ?)
                ON CONFLICT(session_id) DO UPDATE SET count = excluded.count
                """, ps -> ps.setInt(2, count), "set count");
    }

    // ── Summary timestamps ───────────────────────────────────────────────────

    public OptionalDouble getLastSummaryTime(String sessionId) {
        synchronized (lock) {
            if (connection == null) return OptionalDouble.empty();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT last_summary_timestamp FROM session_summary_times WHERE session_id = ?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? OptionalDouble.of(rs.getDouble(1)) : OptionalDouble.empty();
                }
            } catch (SQLException e) {
                log.error("[Counter] Failed to read last summary time for session {}", sessionId, e);
                return OptionalDouble.empty();
            }
        }
    }

    public boolean updateLastSummaryTime(String sessionId, double epochSeconds) {
        return update(sessionId, """
                INSERT INTO session_summary_times (session_id, last_summary_timestamp) VALUES (?, ?)
                ON CONFLICT(session_id) DO UPDATE SET last_summary_timestamp = excluded.last_summary_timestamp
                """, ps -> ps.setDouble(2, epochSeconds), "update summary time");
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean update(String sessionId, String sql, Binder binder, String action) {
        synchronized (lock) {
            if (connection == null) {
                log.debug("[Counter] Skipped {} for session {} — store unavailable", action, sessionId);
                return false;
            }
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, sessionId);
                binder.bind(ps);
                ps.executeUpdate();
                return true;
            } catch (SQLException e) {
                log.error("[Counter] Failed to {} for session {}", action, sessionId, e);
                return false;
            }
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private void closeQuietly() {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[Counter] Error closing counter store connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
