package io.ledgerbridge.storage;

import io.ledgerbridge.ledger.RawEvent;
import io.ledgerbridge.model.FeeEntry;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStateMachine;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.model.SettledItem;
import io.ledgerbridge.model.SettlementItem;
import io.ledgerbridge.model.TerminalTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Open and terminal item tables for both directions. Open rows change only through
 * status-guarded compare-and-set updates; terminal rows are insert-only.
 */
public final class ItemStore {
    private static final String ITEM_COLUMNS = """
            tx_id,event_time_ms,detected_at_ms,sender_address,sender_identity,gross_units,memo,status,
            destination_address,transfer_id,transfer_submitted_at_ms,last_error,updated_at_ms""";

    private final Database database;

    public ItemStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts a freshly detected event. Returns false when the transaction id is already
     * known to any table of {@code kind}.
     */
    public boolean insertDetected(ItemKind kind, RawEvent event, long nowMs) {
        if (event == null || event.txId() == null || event.txId().isBlank()) {
            throw new IllegalArgumentException("event txId must not be blank");
        }
        if (event.grossUnits() < 0L) {
            throw new IllegalArgumentException("event grossUnits must be >= 0: " + event.txId());
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                if (existsInTerminal(c, kind, event.txId())) {
                    c.rollback();
                    return false;
                }
                boolean inserted;
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO " + kind.openTable() + "(tx_id,event_time_ms,detected_at_ms,sender_address,sender_identity,gross_units,memo,status,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?)")) {
                    ps.setString(1, event.txId());
                    ps.setLong(2, event.eventTimeMs());
                    ps.setLong(3, nowMs);
                    ps.setString(4, nullToEmpty(event.senderAddress()));
                    ps.setString(5, nullToEmpty(event.senderIdentity()));
                    ps.setLong(6, event.grossUnits());
                    ps.setString(7, nullToEmpty(event.memo()));
                    ps.setString(8, kind.initialStatus().name());
                    ps.setLong(9, nowMs);
                    inserted = ps.executeUpdate() == 1;
                }
                c.commit();
                return inserted;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert detected " + kind.label() + " " + event.txId(), e);
        }
    }

    public Optional<SettlementItem> findOpen(ItemKind kind, String txId) {
        String sql = "SELECT " + ITEM_COLUMNS + " FROM " + kind.openTable() + " WHERE tx_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, txId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readItem(kind, rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load " + kind.label() + " " + txId, e);
        }
    }

    public Optional<SettledItem> findSettled(ItemKind kind, String txId) {
        try (Connection c = database.openConnection()) {
            for (TerminalTable table : TerminalTable.values()) {
                String sql = "SELECT " + ITEM_COLUMNS + ",settled_units,settled_transfer_id,settled_at_ms,recovered FROM "
                        + kind.table(table) + " WHERE tx_id=?";
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, txId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            return Optional.of(readSettled(kind, table, rs));
                        }
                    }
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load settled " + kind.label() + " " + txId, e);
        }
    }

    public boolean knows(ItemKind kind, String txId) {
        try (Connection c = database.openConnection()) {
            if (existsInTerminal(c, kind, txId)) {
                return true;
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM " + kind.openTable() + " WHERE tx_id=? LIMIT 1")) {
                ps.setString(1, txId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check " + kind.label() + " " + txId, e);
        }
    }

    /**
     * Open items in any of {@code statuses}, oldest event first.
     */
    public List<SettlementItem> listOpen(ItemKind kind, Collection<ItemStatus> statuses, int limit) {
        if (statuses == null || statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(","));
        String sql = "SELECT " + ITEM_COLUMNS + " FROM " + kind.openTable()
                + " WHERE status IN (" + placeholders + ") ORDER BY event_time_ms ASC, tx_id ASC LIMIT ?";
        List<SettlementItem> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            for (ItemStatus status : statuses) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readItem(kind, rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list open " + kind.label() + " items", e);
        }
    }

    /**
     * Moves an open item from {@code expected} to {@code next}. Returns false when the row is
     * no longer in {@code expected}.
     *
     * @throws IllegalStateException    if the move is not allowed for {@code kind}
     * @throws IllegalArgumentException if {@code next} leaves the open table
     */
    public boolean transition(ItemKind kind, String txId, ItemStatus expected, ItemStatus next, ItemUpdate update, long nowMs) {
        ItemStateMachine.validateTransition(kind, expected, next);
        if (next.isTerminal()) {
            throw new IllegalArgumentException("terminal status " + next + " must go through finalizeItem");
        }
        ItemUpdate u = update == null ? ItemUpdate.none() : update;
        String sql = "UPDATE " + kind.openTable() + """
                 SET status=?,
                     destination_address=COALESCE(?,destination_address),
                     transfer_id=CASE WHEN ?=1 THEN NULL ELSE COALESCE(?,transfer_id) END,
                     transfer_submitted_at_ms=CASE WHEN ?=1 THEN NULL ELSE COALESCE(?,transfer_submitted_at_ms) END,
                     last_error=?,
                     updated_at_ms=?
                 WHERE tx_id=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, next.name());
            ps.setString(2, u.destinationAddress());
            ps.setInt(3, u.clearTransfer() ? 1 : 0);
            ps.setString(4, u.transferId());
            ps.setInt(5, u.clearTransfer() ? 1 : 0);
            if (u.transferSubmittedAtMs() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setLong(6, u.transferSubmittedAtMs());
            }
            ps.setString(7, u.lastError());
            ps.setLong(8, nowMs);
            ps.setString(9, txId);
            ps.setString(10, expected.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move " + kind.label() + " " + txId + " to " + next, e);
        }
    }

    /**
     * Records an error on an item without changing its status.
     */
    public boolean recordError(ItemKind kind, String txId, ItemStatus expected, String error, long nowMs) {
        String sql = "UPDATE " + kind.openTable() + " SET last_error=?, updated_at_ms=? WHERE tx_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setLong(2, nowMs);
            ps.setString(3, txId);
            ps.setString(4, expected.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record error on " + kind.label() + " " + txId, e);
        }
    }

    /**
     * Moves an open item into the terminal table of {@code terminal} and books its fee entries
     * in the same transaction. Returns false when the row is no longer in {@code expected}.
     */
    public boolean finalizeItem(
            ItemKind kind,
            String txId,
            ItemStatus expected,
            ItemStatus terminal,
            long settledUnits,
            String settledTransferId,
            List<FeeEntry> fees,
            long nowMs
    ) {
        ItemStateMachine.validateTransition(kind, expected, terminal);
        TerminalTable table = terminal.terminalTable();
        if (table == null) {
            throw new IllegalArgumentException("status " + terminal + " is not terminal");
        }
        String copySql = "INSERT INTO " + kind.table(table) + "(" + ITEM_COLUMNS
                + ",settled_units,settled_transfer_id,settled_at_ms,recovered) SELECT "
                + "tx_id,event_time_ms,detected_at_ms,sender_address,sender_identity,gross_units,memo,?,"
                + "destination_address,transfer_id,transfer_submitted_at_ms,last_error,?,?,?,?,0 FROM "
                + kind.openTable() + " WHERE tx_id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement copy = c.prepareStatement(copySql)) {
                    copy.setString(1, terminal.name());
                    copy.setLong(2, nowMs);
                    copy.setLong(3, settledUnits);
                    copy.setString(4, settledTransferId);
                    copy.setLong(5, nowMs);
                    copy.setString(6, txId);
                    copy.setString(7, expected.name());
                    if (copy.executeUpdate() != 1) {
                        c.rollback();
                        return false;
                    }
                }
                try (PreparedStatement del = c.prepareStatement(
                        "DELETE FROM " + kind.openTable() + " WHERE tx_id=? AND status=?")) {
                    del.setString(1, txId);
                    del.setString(2, expected.name());
                    if (del.executeUpdate() != 1) {
                        c.rollback();
                        return false;
                    }
                }
                if (fees != null) {
                    for (FeeEntry fee : fees) {
                        FeeLedgerStore.insert(c, fee);
                    }
                }
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finalize " + kind.label() + " " + txId + " as " + terminal, e);
        }
    }

    /**
     * Inserts a terminal marker for an item known only from an outgoing transfer memo. Never
     * touches existing rows.
     */
    public boolean insertRecoveredMarker(
            ItemKind kind,
            String txId,
            ItemStatus terminal,
            String transferId,
            String toAddress,
            long units,
            long transferTimeMs,
            long nowMs
    ) {
        TerminalTable table = terminal.terminalTable();
        if (table == null) {
            throw new IllegalArgumentException("status " + terminal + " is not terminal");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                if (existsInTerminal(c, kind, txId) || existsInOpen(c, kind, txId)) {
                    c.rollback();
                    return false;
                }
                boolean inserted;
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO " + kind.table(table)
                                + "(tx_id,event_time_ms,detected_at_ms,gross_units,status,destination_address,transfer_id,updated_at_ms,settled_units,settled_transfer_id,settled_at_ms,recovered) VALUES(?,?,?,0,?,?,?,?,?,?,?,1)")) {
                    ps.setString(1, txId);
                    ps.setLong(2, transferTimeMs);
                    ps.setLong(3, nowMs);
                    ps.setString(4, terminal.name());
                    ps.setString(5, toAddress);
                    ps.setString(6, transferId);
                    ps.setLong(7, nowMs);
                    ps.setLong(8, Math.max(0L, units));
                    ps.setString(9, transferId);
                    ps.setLong(10, nowMs);
                    inserted = ps.executeUpdate() == 1;
                }
                c.commit();
                return inserted;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert recovered marker for " + kind.label() + " " + txId, e);
        }
    }

    /**
     * Oldest event time among open items whose status is not in {@code excluded}.
     */
    public OptionalLong oldestOpenEventTime(ItemKind kind, Set<ItemStatus> excluded) {
        StringBuilder sql = new StringBuilder("SELECT MIN(event_time_ms) FROM ").append(kind.openTable());
        List<ItemStatus> skip = excluded == null ? List.of() : new ArrayList<>(excluded);
        if (!skip.isEmpty()) {
            sql.append(" WHERE status NOT IN (")
                    .append(skip.stream().map(s -> "?").collect(Collectors.joining(",")))
                    .append(')');
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < skip.size(); i++) {
                ps.setString(i + 1, skip.get(i).name());
            }
            return readOptionalLong(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read oldest open " + kind.label() + " event", e);
        }
    }

    public OptionalLong newestEventTime(ItemKind kind) {
        StringBuilder sql = new StringBuilder("SELECT MAX(t) FROM (SELECT MAX(event_time_ms) AS t FROM ")
                .append(kind.openTable());
        for (TerminalTable table : TerminalTable.values()) {
            sql.append(" UNION ALL SELECT MAX(event_time_ms) FROM ").append(kind.table(table));
        }
        sql.append(')');
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            return readOptionalLong(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read newest " + kind.label() + " event", e);
        }
    }

    /**
     * Open rows per status plus terminal rows per terminal status.
     */
    public Map<String, Long> countsByStatus(ItemKind kind) {
        Map<String, Long> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection()) {
            List<String> tables = new ArrayList<>();
            tables.add(kind.openTable());
            for (TerminalTable table : TerminalTable.values()) {
                tables.add(kind.table(table));
            }
            for (String table : tables) {
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT status, COUNT(*) AS n FROM " + table + " GROUP BY status ORDER BY status");
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.merge(rs.getString("status"), rs.getLong("n"), Long::sum);
                    }
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count " + kind.label() + " items", e);
        }
    }

    public List<SettledItem> listSettled(ItemKind kind, TerminalTable table, int limit) {
        String sql = "SELECT " + ITEM_COLUMNS + ",settled_units,settled_transfer_id,settled_at_ms,recovered FROM "
                + kind.table(table) + " ORDER BY settled_at_ms DESC, tx_id ASC LIMIT ?";
        List<SettledItem> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readSettled(kind, table, rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list " + kind.table(table), e);
        }
    }

    /**
     * Sum of settled units per destination address in one terminal table, recovered markers
     * included. Rows without an address are left out.
     */
    public Map<String, Long> settledUnitsByDestination(ItemKind kind, TerminalTable table) {
        String sql = "SELECT destination_address,SUM(settled_units) AS total FROM " + kind.table(table)
                + " WHERE destination_address IS NOT NULL AND destination_address<>''"
                + " GROUP BY destination_address ORDER BY destination_address";
        Map<String, Long> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("destination_address"), rs.getLong("total"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sum " + kind.table(table) + " by destination", e);
        }
    }

    private boolean existsInTerminal(Connection c, ItemKind kind, String txId) throws SQLException {
        StringBuilder sql = new StringBuilder();
        for (TerminalTable table : TerminalTable.values()) {
            if (sql.length() > 0) {
                sql.append(" UNION ALL ");
            }
            sql.append("SELECT 1 FROM ").append(kind.table(table)).append(" WHERE tx_id=?");
        }
        try (PreparedStatement ps = c.prepareStatement(sql + " LIMIT 1")) {
            for (int i = 1; i <= TerminalTable.values().length; i++) {
                ps.setString(i, txId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean existsInOpen(Connection c, ItemKind kind, String txId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM " + kind.openTable() + " WHERE tx_id=? LIMIT 1")) {
            ps.setString(1, txId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static OptionalLong readOptionalLong(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return OptionalLong.empty();
            }
            long value = rs.getLong(1);
            return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(value);
        }
    }

    private static SettlementItem readItem(ItemKind kind, ResultSet rs) throws SQLException {
        long submitted = rs.getLong("transfer_submitted_at_ms");
        Long submittedAt = rs.wasNull() ? null : submitted;
        return new SettlementItem(
                kind,
                rs.getString("tx_id"),
                rs.getLong("event_time_ms"),
                rs.getLong("detected_at_ms"),
                rs.getString("sender_address"),
                rs.getString("sender_identity"),
                rs.getLong("gross_units"),
                rs.getString("memo"),
                ItemStatus.valueOf(rs.getString("status")),
                rs.getString("destination_address"),
                rs.getString("transfer_id"),
                submittedAt,
                rs.getString("last_error"),
                rs.getLong("updated_at_ms")
        );
    }

    private static SettledItem readSettled(ItemKind kind, TerminalTable table, ResultSet rs) throws SQLException {
        return new SettledItem(
                readItem(kind, rs),
                table,
                rs.getLong("settled_units"),
                rs.getString("settled_transfer_id"),
                rs.getLong("settled_at_ms"),
                rs.getInt("recovered") == 1
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
