package io.ledgerbridge.storage;

import io.ledgerbridge.model.FeeEntry;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.FeeSummary;
import io.ledgerbridge.model.ItemKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only fee ledger. One entry per (item, fee kind); the summary table is derived and
 * can be rebuilt at any time.
 */
public final class FeeLedgerStore {
    private final Database database;

    public FeeLedgerStore(Database database) {
        this.database = database;
    }

    public boolean append(FeeEntry entry) {
        try (Connection c = database.openConnection()) {
            return insert(c, entry);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append fee entry for " + entry.itemId(), e);
        }
    }

    static boolean insert(Connection c, FeeEntry entry) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO fee_entries(item_kind,item_id,fee_kind,source_units,destination_units,created_at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, entry.itemKind().name());
            ps.setString(2, entry.itemId());
            ps.setString(3, entry.feeKind().name());
            ps.setLong(4, entry.sourceUnits());
            ps.setLong(5, entry.destinationUnits());
            ps.setLong(6, entry.createdAtMs());
            return ps.executeUpdate() == 1;
        }
    }

    public List<FeeEntry> entriesFor(ItemKind kind, String itemId) {
        String sql = """
                SELECT item_kind,item_id,fee_kind,source_units,destination_units,created_at_ms
                FROM fee_entries
                WHERE item_kind=? AND item_id=?
                ORDER BY id ASC
                """;
        List<FeeEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FeeEntry(
                            ItemKind.valueOf(rs.getString("item_kind")),
                            rs.getString("item_id"),
                            FeeKind.valueOf(rs.getString("fee_kind")),
                            rs.getLong("source_units"),
                            rs.getLong("destination_units"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list fee entries for " + itemId, e);
        }
    }

    /**
     * Replaces the summary table with totals recomputed from the entries.
     */
    public List<FeeSummary> rebuildSummary(long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (Statement st = c.createStatement()) {
                    st.executeUpdate("DELETE FROM fee_summary");
                }
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO fee_summary(item_kind,fee_kind,entry_count,source_units,destination_units,rebuilt_at_ms)
                        SELECT item_kind, fee_kind, COUNT(*), SUM(source_units), SUM(destination_units), ?
                        FROM fee_entries
                        GROUP BY item_kind, fee_kind
                        """)) {
                    ps.setLong(1, nowMs);
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to rebuild fee summary", e);
        }
        return summary();
    }

    public List<FeeSummary> summary() {
        String sql = """
                SELECT item_kind,fee_kind,entry_count,source_units,destination_units,rebuilt_at_ms
                FROM fee_summary
                ORDER BY item_kind, fee_kind
                """;
        List<FeeSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new FeeSummary(
                        ItemKind.valueOf(rs.getString("item_kind")),
                        FeeKind.valueOf(rs.getString("fee_kind")),
                        rs.getLong("entry_count"),
                        rs.getLong("source_units"),
                        rs.getLong("destination_units"),
                        rs.getLong("rebuilt_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read fee summary", e);
        }
    }
}
