package io.ledgerbridge.settlement;

import java.time.Clock;
import java.util.function.BooleanSupplier;

/**
 * Wall-clock and volume bound for one pass. Checked between items only, so an admitted
 * item always runs to completion.
 */
public final class PassBudget {
    public enum StopReason {
        NONE,
        TIME_BUDGET,
        VOLUME_LIMIT,
        STOP_REQUESTED
    }

    private final Clock clock;
    private final long deadlineMs;
    private final int volumeLimit;
    private final BooleanSupplier stopRequested;
    private int admitted;
    private StopReason stopReason = StopReason.NONE;

    public PassBudget(Clock clock, long timeBudgetMs, int volumeLimit, BooleanSupplier stopRequested) {
        this.clock = clock;
        this.deadlineMs = clock.millis() + Math.max(0L, timeBudgetMs);
        this.volumeLimit = Math.max(0, volumeLimit);
        this.stopRequested = stopRequested == null ? () -> false : stopRequested;
    }

    public boolean tryAdmit() {
        if (stopReason != StopReason.NONE) {
            return false;
        }
        if (stopRequested.getAsBoolean()) {
            stopReason = StopReason.STOP_REQUESTED;
        } else if (clock.millis() >= deadlineMs) {
            stopReason = StopReason.TIME_BUDGET;
        } else if (admitted >= volumeLimit) {
            stopReason = StopReason.VOLUME_LIMIT;
        } else {
            admitted++;
            return true;
        }
        return false;
    }

    public int admitted() {
        return admitted;
    }

    public StopReason stopReason() {
        return stopReason;
    }
}
