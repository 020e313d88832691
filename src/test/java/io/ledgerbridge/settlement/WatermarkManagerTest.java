package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.RawEvent;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.Database;
import io.ledgerbridge.storage.ItemStore;
import io.ledgerbridge.storage.WatermarkStore;
import io.ledgerbridge.testing.FakeDestinationLedger;
import io.ledgerbridge.testing.MutableClock;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class WatermarkManagerTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void proposesOldestOpenEventMinusMarginAndSkipsStuckItems() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-watermark-propose-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            Assertions.assertEquals(-1L, f.manager.propose(ItemKind.DEPOSIT), "no events yet");

            f.items.insertDetected(ItemKind.DEPOSIT, new RawEvent("old", NOW - 50_000L, "s", "", 1L, ""), NOW);
            f.items.insertDetected(ItemKind.DEPOSIT, new RawEvent("new", NOW - 10_000L, "s", "", 1L, ""), NOW);
            Assertions.assertEquals(NOW - 51_000L, f.manager.propose(ItemKind.DEPOSIT));

            f.items.transition(ItemKind.DEPOSIT, "old", ItemStatus.DETECTED, ItemStatus.TO_BE_REFUNDED, ItemUpdate.none(), NOW);
            f.items.transition(ItemKind.DEPOSIT, "old", ItemStatus.TO_BE_REFUNDED, ItemStatus.TO_BE_QUARANTINED, ItemUpdate.none(), NOW);
            f.items.transition(ItemKind.DEPOSIT, "old", ItemStatus.TO_BE_QUARANTINED, ItemStatus.QUARANTINE_FAILED, ItemUpdate.none(), NOW);
            Assertions.assertEquals(NOW - 11_000L, f.manager.propose(ItemKind.DEPOSIT));

            f.items.transition(ItemKind.DEPOSIT, "new", ItemStatus.DETECTED, ItemStatus.TO_BE_REFUNDED, ItemUpdate.none(), NOW);
            f.items.finalizeItem(ItemKind.DEPOSIT, "new", ItemStatus.TO_BE_REFUNDED, ItemStatus.FEE_ONLY, 0L, null, List.of(), NOW);
            Assertions.assertEquals(NOW - 11_000L, f.manager.propose(ItemKind.DEPOSIT), "falls back to newest known event");
            Assertions.assertEquals(Map.of(ItemKind.DEPOSIT, NOW - 11_000L), f.manager.proposals());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void heldDetectionFloorCapsProposalsUntilReleased() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-watermark-floor-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            f.items.insertDetected(ItemKind.DEPOSIT, new RawEvent("seen", NOW - 10_000L, "s", "", 1L, ""), NOW);

            f.manager.holdBelow(ItemKind.DEPOSIT, NOW - 90_000L);
            f.manager.holdBelow(ItemKind.DEPOSIT, NOW - 40_000L);
            Assertions.assertEquals(NOW - 91_000L, f.manager.propose(ItemKind.DEPOSIT), "lowest held floor wins");
            Assertions.assertEquals(-1L, f.manager.propose(ItemKind.CREDIT), "other chain unaffected");

            f.manager.releaseFloor(ItemKind.DEPOSIT);
            Assertions.assertEquals(NOW - 11_000L, f.manager.propose(ItemKind.DEPOSIT));
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void commitPublishesThenStoresAndNeverMovesBackwards() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-watermark-commit-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            f.watermarks.propose(ItemKind.DEPOSIT, 5_000L, NOW);
            f.watermarks.propose(ItemKind.CREDIT, 7_000L, NOW);

            WatermarkManager.WatermarkCommit first = f.manager.commit();
            Assertions.assertTrue(first.published());
            Assertions.assertEquals(Map.of(ItemKind.DEPOSIT, 5_000L, ItemKind.CREDIT, 7_000L), f.manager.committed());
            Assertions.assertTrue(f.manager.proposals().isEmpty());
            Assertions.assertEquals(1, f.destination.publishCalls().size());

            f.watermarks.propose(ItemKind.DEPOSIT, 4_000L, NOW);
            f.watermarks.propose(ItemKind.CREDIT, 9_000L, NOW);
            WatermarkManager.WatermarkCommit second = f.manager.commit();
            Assertions.assertEquals(List.of(ItemKind.DEPOSIT), second.rejected());
            Assertions.assertEquals(Map.of("credit", 9_000L), second.advanced());
            Assertions.assertEquals(Map.of(ItemKind.DEPOSIT, 5_000L, ItemKind.CREDIT, 9_000L), f.manager.committed());
            Assertions.assertEquals(Map.of(ItemKind.CREDIT, 9_000L), f.destination.publishCalls().get(1));
            Assertions.assertTrue(f.manager.proposals().isEmpty());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void failedPublishKeepsProposals() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-watermark-publish-fail-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            f.watermarks.propose(ItemKind.CREDIT, 3_000L, NOW);
            f.destination.setPublishFailure(new LedgerException(LedgerException.Kind.TRANSIENT, "fee market spike"));

            WatermarkManager.WatermarkCommit failed = f.manager.commit();
            Assertions.assertFalse(failed.published());
            Assertions.assertEquals("fee market spike", failed.error());
            Assertions.assertTrue(f.manager.committed().isEmpty());
            Assertions.assertEquals(Map.of(ItemKind.CREDIT, 3_000L), f.manager.proposals());

            f.destination.setPublishFailure(null);
            Assertions.assertTrue(f.manager.commit().published());
            Assertions.assertEquals(Map.of(ItemKind.CREDIT, 3_000L), f.manager.committed());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void scanStartIsClampedToTheLookback() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-watermark-lookback-");
        try (LedgerCallGuard calls = new LedgerCallGuard(2_000L)) {
            Fixture f = new Fixture(root, calls);
            long lookback = f.settings.maxWatermarkLookbackMs();
            Assertions.assertEquals(NOW - lookback, f.manager.scanFrom(ItemKind.DEPOSIT));
            f.watermarks.commitAndClear(Map.of(ItemKind.DEPOSIT, NOW - 1_000L), List.of(), NOW);
            Assertions.assertEquals(NOW - 1_000L, f.manager.scanFrom(ItemKind.DEPOSIT));
            Assertions.assertEquals(NOW - lookback, f.manager.scanFrom(ItemKind.CREDIT));
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final BridgeSettings settings;
        final ItemStore items;
        final WatermarkStore watermarks;
        final FakeDestinationLedger destination;
        final WatermarkManager manager;

        Fixture(Path root, LedgerCallGuard calls) throws Exception {
            MutableClock clock = new MutableClock(NOW);
            settings = TestBridge.writeSettings(root, TestBridge.baseSettings());
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            items = new ItemStore(db);
            watermarks = new WatermarkStore(db);
            destination = new FakeDestinationLedger(clock);
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), clock);
            manager = new WatermarkManager(items, watermarks, destination, calls, settings, audit, clock);
        }
    }
}
