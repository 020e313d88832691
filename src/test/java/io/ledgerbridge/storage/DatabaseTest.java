package io.ledgerbridge.storage;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.TerminalTable;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

final class DatabaseTest {

    @Test
    void initAppliesEachMigrationOnceAndCreatesItsTables() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-db-migrations-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            db.init();

            List<Database.SchemaMigrationRow> rows = db.listSchemaMigrations(10);
            Assertions.assertEquals(
                    Set.of("20261001_001_terminal_event_indexes", "20261017_002_detection_floors"),
                    rows.stream().map(Database.SchemaMigrationRow::version).collect(Collectors.toSet()));
            Assertions.assertEquals(2, rows.size());
            Assertions.assertTrue(rows.stream().allMatch(Database.SchemaMigrationRow::success));

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery(
                        "SELECT name FROM sqlite_master WHERE type='table' AND name='detection_floors'")) {
                    Assertions.assertTrue(rs.next());
                }
                Set<String> columns = new HashSet<>();
                try (ResultSet rs = st.executeQuery(
                        "PRAGMA table_info(" + ItemKind.DEPOSIT.table(TerminalTable.PROCESSED) + ")")) {
                    while (rs.next()) {
                        columns.add(rs.getString("name"));
                    }
                }
                Assertions.assertTrue(columns.contains("recovered"));
                Assertions.assertTrue(columns.contains("destination_address"));
            }
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }
}
