package io.ledgerbridge.storage;

import io.ledgerbridge.model.ItemKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Watermark proposals and committed watermarks, one row per chain. A committed value never
 * moves backwards.
 */
public final class WatermarkStore {
    private final Database database;

    public WatermarkStore(Database database) {
        this.database = database;
    }

    public void propose(ItemKind chain, long valueMs, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                INSERT INTO watermark_proposals(chain,value_ms,proposed_at_ms) VALUES(?,?,?)
                ON CONFLICT(chain) DO UPDATE SET value_ms=excluded.value_ms, proposed_at_ms=excluded.proposed_at_ms
                """)) {
            ps.setString(1, chain.name());
            ps.setLong(2, valueMs);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to propose watermark for " + chain.label(), e);
        }
    }

    /**
     * Records that events at or after {@code valueMs} were fetched but not stored. A lower
     * floor already held for the chain wins.
     */
    public void holdFloor(ItemKind chain, long valueMs, long nowMs) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                INSERT INTO detection_floors(chain,value_ms,set_at_ms) VALUES(?,?,?)
                ON CONFLICT(chain) DO UPDATE SET
                    value_ms=MIN(detection_floors.value_ms, excluded.value_ms),
                    set_at_ms=excluded.set_at_ms
                """)) {
            ps.setString(1, chain.name());
            ps.setLong(2, valueMs);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to hold detection floor for " + chain.label(), e);
        }
    }

    public void releaseFloor(ItemKind chain) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM detection_floors WHERE chain=?")) {
            ps.setString(1, chain.name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release detection floor for " + chain.label(), e);
        }
    }

    public Optional<Long> floor(ItemKind chain) {
        return Optional.ofNullable(readMap("SELECT chain,value_ms FROM detection_floors", "floors").get(chain));
    }

    public Map<ItemKind, Long> proposals() {
        return readMap("SELECT chain,value_ms FROM watermark_proposals", "proposals");
    }

    public Map<ItemKind, Long> committed() {
        return readMap("SELECT chain,value_ms FROM watermarks", "watermarks");
    }

    public Optional<Long> committed(ItemKind chain) {
        return Optional.ofNullable(committed().get(chain));
    }

    /**
     * Stores {@code advanced} (each value only if it is above the committed one) and clears
     * the proposals of {@code consumed}, in one transaction.
     */
    public void commitAndClear(Map<ItemKind, Long> advanced, Collection<ItemKind> consumed, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement up = c.prepareStatement("""
                        INSERT INTO watermarks(chain,value_ms,committed_at_ms) VALUES(?,?,?)
                        ON CONFLICT(chain) DO UPDATE SET
                            value_ms=excluded.value_ms,
                            committed_at_ms=excluded.committed_at_ms
                        WHERE excluded.value_ms >= watermarks.value_ms
                        """)) {
                    for (Map.Entry<ItemKind, Long> e : advanced.entrySet()) {
                        up.setString(1, e.getKey().name());
                        up.setLong(2, e.getValue());
                        up.setLong(3, nowMs);
                        up.executeUpdate();
                    }
                }
                try (PreparedStatement del = c.prepareStatement("DELETE FROM watermark_proposals WHERE chain=?")) {
                    for (ItemKind chain : consumed) {
                        del.setString(1, chain.name());
                        del.executeUpdate();
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to commit watermarks", e);
        }
    }

    private Map<ItemKind, Long> readMap(String sql, String what) {
        Map<ItemKind, Long> out = new EnumMap<>(ItemKind.class);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(ItemKind.valueOf(rs.getString("chain")), rs.getLong("value_ms"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read watermark " + what, e);
        }
    }
}
