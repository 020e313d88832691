package io.ledgerbridge.governor;

import io.ledgerbridge.storage.AttemptStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Bounds side-effecting retries. An action may run only while its attempt count is below
 * the limit and the cooldown since its last attempt has elapsed; both are checked together.
 *
 * <p>Callers record the attempt before acting, so a crash between the two costs at most one
 * skipped attempt and never an unrecorded one.
 */
public final class AttemptGovernor {
    private final AttemptStore store;
    private final long cooldownMs;
    private final Clock clock;

    public AttemptGovernor(AttemptStore store, long cooldownMs, Clock clock) {
        this.store = store;
        this.cooldownMs = Math.max(0L, cooldownMs);
        this.clock = clock;
    }

    public enum Decision {
        ALLOWED,
        COOLING_DOWN,
        EXHAUSTED
    }

    public Decision evaluate(String actionKey, int maxAttempts) {
        Optional<AttemptStore.AttemptRecord> record = store.find(actionKey);
        if (record.isEmpty()) {
            return maxAttempts > 0 ? Decision.ALLOWED : Decision.EXHAUSTED;
        }
        AttemptStore.AttemptRecord r = record.get();
        if (r.count() >= maxAttempts) {
            return Decision.EXHAUSTED;
        }
        if (clock.millis() - r.lastAttemptMs() < cooldownMs) {
            return Decision.COOLING_DOWN;
        }
        return Decision.ALLOWED;
    }

    public boolean shouldAttempt(String actionKey, int maxAttempts) {
        return evaluate(actionKey, maxAttempts) == Decision.ALLOWED;
    }

    public int recordAttempt(String actionKey) {
        return store.increment(actionKey, clock.millis());
    }

    public int attempts(String actionKey) {
        return store.find(actionKey).map(AttemptStore.AttemptRecord::count).orElse(0);
    }

    public void reset(String actionKey) {
        store.reset(actionKey, clock.millis());
    }

    public List<AttemptStore.AttemptLogRow> history(String actionKey) {
        return store.history(actionKey);
    }
}
