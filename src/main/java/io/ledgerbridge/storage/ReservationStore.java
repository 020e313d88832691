package io.ledgerbridge.storage;

import io.ledgerbridge.model.ItemKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Per-item mutual exclusion with expiry. At most one live reservation exists per
 * (kind, key); an expired one is taken over by the next acquirer.
 */
public final class ReservationStore {
    private final Database database;

    public ReservationStore(Database database) {
        this.database = database;
    }

    public boolean acquire(ItemKind kind, String key, String holder, long ttlMs, long nowMs) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("holder must not be blank");
        }
        String sql = """
                INSERT INTO reservations(item_kind,item_key,holder,acquired_at_ms,expires_at_ms)
                VALUES(?,?,?,?,?)
                ON CONFLICT(item_kind,item_key) DO UPDATE SET
                    holder=excluded.holder,
                    acquired_at_ms=excluded.acquired_at_ms,
                    expires_at_ms=excluded.expires_at_ms
                WHERE reservations.expires_at_ms <= ?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            ps.setString(3, holder);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs + Math.max(1L, ttlMs));
            ps.setLong(6, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to acquire reservation " + kind.label() + ":" + key, e);
        }
    }

    /**
     * Acquires and wraps the reservation in a lease that releases itself on close.
     */
    public Optional<ReservationLease> tryReserve(ItemKind kind, String key, String holder, long ttlMs, long nowMs) {
        if (!acquire(kind, key, holder, ttlMs, nowMs)) {
            return Optional.empty();
        }
        return Optional.of(new ReservationLease(this, kind, key, holder, nowMs + Math.max(1L, ttlMs)));
    }

    public boolean release(ItemKind kind, String key, String holder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "DELETE FROM reservations WHERE item_kind=? AND item_key=? AND holder=?")) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            ps.setString(3, holder);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release reservation " + kind.label() + ":" + key, e);
        }
    }

    public int sweepExpired(long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "DELETE FROM reservations WHERE expires_at_ms <= ?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sweep expired reservations", e);
        }
    }

    public Optional<Reservation> find(ItemKind kind, String key) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT holder,acquired_at_ms,expires_at_ms FROM reservations WHERE item_kind=? AND item_key=?")) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Reservation(
                        kind,
                        key,
                        rs.getString("holder"),
                        rs.getLong("acquired_at_ms"),
                        rs.getLong("expires_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load reservation " + kind.label() + ":" + key, e);
        }
    }

    public long countLive(long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM reservations WHERE expires_at_ms > ?")) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count reservations", e);
        }
    }

    public record Reservation(ItemKind kind, String key, String holder, long acquiredAtMs, long expiresAtMs) {
    }
}
