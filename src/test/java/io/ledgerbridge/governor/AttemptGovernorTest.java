package io.ledgerbridge.governor;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.storage.AttemptStore;
import io.ledgerbridge.storage.Database;
import io.ledgerbridge.testing.MutableClock;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class AttemptGovernorTest {

    @Test
    void capsAttemptsAndHonorsCooldown() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-governor-cap-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            MutableClock clock = new MutableClock(1_800_000_000_000L);
            AttemptGovernor governor = new AttemptGovernor(new AttemptStore(db), 10_000L, clock);
            String key = "deposit:payout:dep-1";

            Assertions.assertEquals(AttemptGovernor.Decision.ALLOWED, governor.evaluate(key, 2));
            Assertions.assertEquals(1, governor.recordAttempt(key));
            Assertions.assertEquals(AttemptGovernor.Decision.COOLING_DOWN, governor.evaluate(key, 2));
            Assertions.assertFalse(governor.shouldAttempt(key, 2));

            clock.advance(10_000L);
            Assertions.assertTrue(governor.shouldAttempt(key, 2));
            Assertions.assertEquals(2, governor.recordAttempt(key));
            clock.advance(60_000L);
            Assertions.assertEquals(AttemptGovernor.Decision.EXHAUSTED, governor.evaluate(key, 2));
            Assertions.assertEquals(2, governor.attempts(key));
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void resetClearsTheCounterAndKeepsHistory() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-governor-reset-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            AttemptGovernor governor = new AttemptGovernor(new AttemptStore(db), 0L, new MutableClock(1_800_000_000_000L));
            String key = "credit:refund:cr-1";
            governor.recordAttempt(key);
            governor.recordAttempt(key);
            governor.reset(key);

            Assertions.assertEquals(0, governor.attempts(key));
            Assertions.assertEquals(AttemptGovernor.Decision.ALLOWED, governor.evaluate(key, 1));
            List<AttemptStore.AttemptLogRow> history = governor.history(key);
            Assertions.assertEquals(3, history.size());
            Assertions.assertEquals(AttemptStore.EVENT_ATTEMPT, history.get(0).event());
            Assertions.assertEquals(2, history.get(1).attemptCount());
            Assertions.assertEquals(AttemptStore.EVENT_RESET, history.get(2).event());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void zeroBudgetIsExhaustedUpFront() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-governor-zero-");
        try {
            Database db = new Database(BridgeConfig.fromRoot(root.toString()));
            db.init();
            AttemptGovernor governor = new AttemptGovernor(new AttemptStore(db), 0L, new MutableClock(0L));
            Assertions.assertEquals(AttemptGovernor.Decision.EXHAUSTED, governor.evaluate("k", 0));
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }
}
