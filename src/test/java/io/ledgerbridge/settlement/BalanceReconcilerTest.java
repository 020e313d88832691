package io.ledgerbridge.settlement;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.Database;
import io.ledgerbridge.storage.ItemStore;
import io.ledgerbridge.testing.FakeDestinationLedger;
import io.ledgerbridge.testing.MutableClock;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class BalanceReconcilerTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void surplusAboveToleranceIsReported() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-balance-surplus-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            f.items.insertRecoveredMarker(ItemKind.DEPOSIT, "dep-1", ItemStatus.PROCESSED, "t-1", "dst-a", 900_000L, NOW, NOW);
            f.items.insertRecoveredMarker(ItemKind.DEPOSIT, "dep-2", ItemStatus.PROCESSED, "t-2", "dst-a", 100_000L, NOW, NOW);
            f.items.insertRecoveredMarker(ItemKind.DEPOSIT, "dep-3", ItemStatus.PROCESSED, "t-3", "dst-b", 5_000_000L, NOW, NOW);
            f.items.insertRecoveredMarker(ItemKind.DEPOSIT, "dep-4", ItemStatus.REFUNDED, "t-4", "dst-c", 7_000_000L, NOW, NOW);
            f.destination.setBalance("dst-a", 1_000_001L);
            f.destination.setBalance("dst-b", 5_000_006L);
            f.destination.setBalance("dst-c", 9_000_000L);

            BalanceReport report = f.reconciler.reconcile();
            Assertions.assertEquals(2, report.checkedAddresses(), "only processed deposits count");
            Assertions.assertEquals(List.of(new BalanceReport.Discrepancy("dst-b", 5_000_000L, 5_000_006L, 6L)),
                    report.discrepancies());
            Assertions.assertEquals(6L, report.totalSurplusUnits());
            Assertions.assertTrue(report.unreadable().isEmpty());

            List<JsonNode> rows = f.audit.tail(5);
            Assertions.assertEquals("balance.discrepancy", rows.get(rows.size() - 2).path("action").asText());
            Assertions.assertEquals("dst-b", rows.get(rows.size() - 2).path("details").path("address").asText());
            JsonNode summary = rows.get(rows.size() - 1);
            Assertions.assertEquals("balance.reconcile", summary.path("action").asText());
            Assertions.assertEquals("discrepancy", summary.path("result").asText());
            Assertions.assertTrue(f.destination.transfers().isEmpty(), "report only");
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void unreadableBalancesAreListedNotFlagged() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-balance-unreadable-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            f.items.insertRecoveredMarker(ItemKind.DEPOSIT, "dep-1", ItemStatus.PROCESSED, "t-1", "dst-a", 900_000L, NOW, NOW);
            f.destination.setReadFailure(new LedgerException(LedgerException.Kind.TRANSIENT, "rpc down"));

            BalanceReport report = f.reconciler.reconcile();
            Assertions.assertTrue(report.clean());
            Assertions.assertEquals(List.of("dst-a"), report.unreadable());
            Assertions.assertEquals("partial", f.audit.tail(1).get(0).path("result").asText());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void reconcileIfDueHonoursTheInterval() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-balance-interval-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            BalanceReport first = f.reconciler.reconcileIfDue();
            Assertions.assertEquals(NOW, first.checkedAtMs());

            f.clock.advance(f.settings.balanceCheckIntervalMs() - 1L);
            Assertions.assertSame(first, f.reconciler.reconcileIfDue());

            f.clock.advance(1L);
            Assertions.assertEquals(NOW + f.settings.balanceCheckIntervalMs(), f.reconciler.reconcileIfDue().checkedAtMs());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void toleranceIsOnePartPerMillionWithAFloorOfOne() {
        Assertions.assertEquals(1L, BalanceReconciler.tolerance(0L));
        Assertions.assertEquals(1L, BalanceReconciler.tolerance(1_999_999L));
        Assertions.assertEquals(5L, BalanceReconciler.tolerance(5_000_000L));
    }

    private static final class Fixture {
        final MutableClock clock = new MutableClock(NOW);
        final BridgeSettings settings;
        final ItemStore items;
        final FakeDestinationLedger destination;
        final AuditLogger audit;
        final BalanceReconciler reconciler;

        Fixture(Path root, LedgerCallGuard calls) throws Exception {
            settings = TestBridge.writeSettings(root, TestBridge.baseSettings());
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            items = new ItemStore(db);
            destination = new FakeDestinationLedger(clock);
            audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), clock);
            reconciler = new BalanceReconciler(items, destination, calls, settings, audit, clock);
        }
    }
}
