package io.ledgerbridge.storage;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class ReservationStoreTest {
    private static final long NOW = 1_800_000_000_000L;

    @Test
    void onlyOneHolderWinsUnderContention() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-reservation-race-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            ReservationStore store = new ReservationStore(db);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String holder = "engine-" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    return store.acquire(ItemKind.DEPOSIT, "dep-1", holder, 60_000L, NOW);
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            Assertions.assertEquals(1, winners);
            Assertions.assertEquals(1L, store.countLive(NOW));
        } finally {
            pool.shutdownNow();
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void expiredReservationIsTakenOverAndSwept() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-reservation-expiry-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            ReservationStore store = new ReservationStore(db);

            Assertions.assertTrue(store.acquire(ItemKind.CREDIT, "cr-1", "engine-a", 1_000L, NOW));
            Assertions.assertFalse(store.acquire(ItemKind.CREDIT, "cr-1", "engine-b", 1_000L, NOW + 999L));
            Assertions.assertTrue(store.acquire(ItemKind.DEPOSIT, "cr-1", "engine-b", 1_000L, NOW), "kinds are separate keys");
            Assertions.assertTrue(store.acquire(ItemKind.CREDIT, "cr-1", "engine-b", 1_000L, NOW + 1_000L));
            Assertions.assertEquals("engine-b", store.find(ItemKind.CREDIT, "cr-1").orElseThrow().holder());

            Assertions.assertFalse(store.release(ItemKind.CREDIT, "cr-1", "engine-a"), "only the holder releases");
            Assertions.assertEquals(2, store.sweepExpired(NOW + 5_000L));
            Assertions.assertTrue(store.find(ItemKind.CREDIT, "cr-1").isEmpty());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void leaseReleasesOnClose() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-reservation-lease-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            ReservationStore store = new ReservationStore(db);
            Optional<ReservationLease> lease = store.tryReserve(ItemKind.DEPOSIT, "dep-9", "engine-a", 60_000L, NOW);
            Assertions.assertTrue(lease.isPresent());
            try (ReservationLease held = lease.get()) {
                Assertions.assertEquals(NOW + 60_000L, held.expiresAtMs());
                Assertions.assertTrue(store.tryReserve(ItemKind.DEPOSIT, "dep-9", "engine-b", 60_000L, NOW).isEmpty());
            }
            Assertions.assertTrue(store.find(ItemKind.DEPOSIT, "dep-9").isEmpty());
            Assertions.assertTrue(store.tryReserve(ItemKind.DEPOSIT, "dep-9", "engine-b", 60_000L, NOW).isPresent());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }
}
