package io.ledgerbridge.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attempt counters keyed by action, plus the append-only attempt history.
 */
public final class AttemptStore {
    public static final String EVENT_ATTEMPT = "attempt";
    public static final String EVENT_RESET = "reset";

    private final Database database;

    public AttemptStore(Database database) {
        this.database = database;
    }

    public Optional<AttemptRecord> find(String actionKey) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT action_key,attempt_count,last_attempt_ms FROM attempts WHERE action_key=?")) {
            ps.setString(1, actionKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new AttemptRecord(
                        rs.getString("action_key"),
                        rs.getInt("attempt_count"),
                        rs.getLong("last_attempt_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load attempts for " + actionKey, e);
        }
    }

    /**
     * Increments the counter and appends a history row atomically. Returns the new count.
     */
    public int increment(String actionKey, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement up = c.prepareStatement("""
                        INSERT INTO attempts(action_key,attempt_count,last_attempt_ms,updated_at_ms)
                        VALUES(?,1,?,?)
                        ON CONFLICT(action_key) DO UPDATE SET
                            attempt_count=attempts.attempt_count+1,
                            last_attempt_ms=excluded.last_attempt_ms,
                            updated_at_ms=excluded.updated_at_ms
                        """)) {
                    up.setString(1, actionKey);
                    up.setLong(2, nowMs);
                    up.setLong(3, nowMs);
                    up.executeUpdate();
                }
                int count;
                try (PreparedStatement read = c.prepareStatement(
                        "SELECT attempt_count FROM attempts WHERE action_key=?")) {
                    read.setString(1, actionKey);
                    try (ResultSet rs = read.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("attempt row vanished for " + actionKey);
                        }
                        count = rs.getInt(1);
                    }
                }
                appendLog(c, actionKey, EVENT_ATTEMPT, count, nowMs);
                c.commit();
                return count;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record attempt for " + actionKey, e);
        }
    }

    /**
     * Clears the counter. History is kept.
     */
    public boolean reset(String actionKey, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                boolean removed;
                try (PreparedStatement del = c.prepareStatement("DELETE FROM attempts WHERE action_key=?")) {
                    del.setString(1, actionKey);
                    removed = del.executeUpdate() == 1;
                }
                if (removed) {
                    appendLog(c, actionKey, EVENT_RESET, 0, nowMs);
                }
                c.commit();
                return removed;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset attempts for " + actionKey, e);
        }
    }

    public List<AttemptLogRow> history(String actionKey) {
        List<AttemptLogRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT action_key,event,attempt_count,occurred_at_ms FROM attempt_log WHERE action_key=? ORDER BY id ASC")) {
            ps.setString(1, actionKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AttemptLogRow(
                            rs.getString("action_key"),
                            rs.getString("event"),
                            rs.getInt("attempt_count"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read attempt history for " + actionKey, e);
        }
    }

    private static void appendLog(Connection c, String actionKey, String event, int count, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO attempt_log(action_key,event,attempt_count,occurred_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, actionKey);
            ps.setString(2, event);
            ps.setInt(3, count);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        }
    }

    public record AttemptRecord(String actionKey, int count, long lastAttemptMs) {
    }

    public record AttemptLogRow(String actionKey, String event, int attemptCount, long occurredAtMs) {
    }
}
