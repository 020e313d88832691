package io.ledgerbridge.storage;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.TerminalTable;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "ledgerbridge.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private final BridgeConfig config;
    private final String jdbcUrl;

    public Database(BridgeConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public BridgeConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            for (ItemKind kind : ItemKind.values()) {
                st.execute("""
                        CREATE TABLE IF NOT EXISTS %s (
                            tx_id TEXT PRIMARY KEY,
                            event_time_ms INTEGER NOT NULL,
                            detected_at_ms INTEGER NOT NULL,
                            sender_address TEXT NOT NULL DEFAULT '',
                            sender_identity TEXT NOT NULL DEFAULT '',
                            gross_units INTEGER NOT NULL,
                            memo TEXT NOT NULL DEFAULT '',
                            status TEXT NOT NULL,
                            destination_address TEXT,
                            transfer_id TEXT,
                            transfer_submitted_at_ms INTEGER,
                            last_error TEXT,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """.formatted(kind.openTable()));
                for (TerminalTable table : TerminalTable.values()) {
                    st.execute("""
                            CREATE TABLE IF NOT EXISTS %s (
                                tx_id TEXT PRIMARY KEY,
                                event_time_ms INTEGER NOT NULL,
                                detected_at_ms INTEGER NOT NULL,
                                sender_address TEXT NOT NULL DEFAULT '',
                                sender_identity TEXT NOT NULL DEFAULT '',
                                gross_units INTEGER NOT NULL,
                                memo TEXT NOT NULL DEFAULT '',
                                status TEXT NOT NULL,
                                destination_address TEXT,
                                transfer_id TEXT,
                                transfer_submitted_at_ms INTEGER,
                                last_error TEXT,
                                updated_at_ms INTEGER NOT NULL,
                                settled_units INTEGER NOT NULL DEFAULT 0,
                                settled_transfer_id TEXT,
                                settled_at_ms INTEGER NOT NULL,
                                recovered INTEGER NOT NULL DEFAULT 0
                            )
                            """.formatted(kind.table(table)));
                }
            }

            st.execute("""
                    CREATE TABLE IF NOT EXISTS reservations (
                        item_kind TEXT NOT NULL,
                        item_key TEXT NOT NULL,
                        holder TEXT NOT NULL,
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(item_kind, item_key)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS attempts (
                        action_key TEXT PRIMARY KEY,
                        attempt_count INTEGER NOT NULL,
                        last_attempt_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS attempt_log (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        action_key TEXT NOT NULL,
                        event TEXT NOT NULL,
                        attempt_count INTEGER NOT NULL,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS watermark_proposals (
                        chain TEXT PRIMARY KEY,
                        value_ms INTEGER NOT NULL,
                        proposed_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS watermarks (
                        chain TEXT PRIMARY KEY,
                        value_ms INTEGER NOT NULL,
                        committed_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS fee_entries (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        item_kind TEXT NOT NULL,
                        item_id TEXT NOT NULL,
                        fee_kind TEXT NOT NULL,
                        source_units INTEGER NOT NULL,
                        destination_units INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(item_kind, item_id, fee_kind)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS fee_summary (
                        item_kind TEXT NOT NULL,
                        fee_kind TEXT NOT NULL,
                        entry_count INTEGER NOT NULL,
                        source_units INTEGER NOT NULL,
                        destination_units INTEGER NOT NULL,
                        rebuilt_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(item_kind, fee_kind)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            for (ItemKind kind : ItemKind.values()) {
                st.execute("CREATE INDEX IF NOT EXISTS idx_%1$s_status_event ON %1$s(status, event_time_ms)"
                        .formatted(kind.openTable()));
            }
            st.execute("CREATE INDEX IF NOT EXISTS idx_reservations_expires ON reservations(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_attempt_log_key ON attempt_log(action_key, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_fee_entries_created ON fee_entries(created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<String> terminalIndexes = new ArrayList<>();
        for (ItemKind kind : ItemKind.values()) {
            for (TerminalTable table : TerminalTable.values()) {
                terminalIndexes.add("CREATE INDEX IF NOT EXISTS idx_%1$s_event ON %1$s(event_time_ms)"
                        .formatted(kind.table(table)));
            }
        }
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_terminal_event_indexes",
                "Index terminal tables by event time for watermark proposals",
                terminalIndexes
        ));
        steps.add(new MigrationStep(
                "20261017_002_detection_floors",
                "Hold watermark proposals below events a detection pass did not reach",
                List.of("""
                        CREATE TABLE IF NOT EXISTS detection_floors (
                            chain TEXT PRIMARY KEY,
                            value_ms INTEGER NOT NULL,
                            set_at_ms INTEGER NOT NULL
                        )
                        """)
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
