package io.ledgerbridge.runtime;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.model.ItemKind;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Drives detection, advancement and maintenance on independent cadences. A stop request is
 * seen by the running pass between items, so an item already admitted always finishes.
 */
public final class PollScheduler {
    private static final long IDLE_SLEEP_MS = 50L;

    private final SettlementRuntime runtime;
    private final Clock clock;
    private final long detectionIntervalMs;
    private final long advancementIntervalMs;
    private final long maintenanceIntervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Map<ItemKind, Long> lastDetection = new EnumMap<>(ItemKind.class);
    private final Map<ItemKind, Long> lastAdvancement = new EnumMap<>(ItemKind.class);
    private long lastMaintenance = Long.MIN_VALUE;

    public PollScheduler(SettlementRuntime runtime, BridgeSettings settings, Clock clock) {
        this.runtime = runtime;
        this.clock = clock;
        this.detectionIntervalMs = settings.detectionIntervalMs();
        this.advancementIntervalMs = settings.advancementIntervalMs();
        this.maintenanceIntervalMs = settings.maintenanceIntervalMs();
    }

    /**
     * Runs every pass that is due at the current time and returns what ran.
     */
    public TickOutcome tick() {
        long now = clock.millis();
        List<SettlementRuntime.PassOutcome> passes = new ArrayList<>();
        for (ItemKind kind : ItemKind.values()) {
            if (stopRequested.get()) {
                break;
            }
            if (due(lastDetection.get(kind), detectionIntervalMs, now)) {
                lastDetection.put(kind, now);
                passes.add(runtime.runDetectionPass(kind, stopRequested::get));
            }
        }
        for (ItemKind kind : ItemKind.values()) {
            if (stopRequested.get()) {
                break;
            }
            if (due(lastAdvancement.get(kind), advancementIntervalMs, now)) {
                lastAdvancement.put(kind, now);
                passes.add(runtime.runAdvancementPass(kind, stopRequested::get));
            }
        }
        SettlementRuntime.MaintenanceOutcome maintenance = null;
        if (!stopRequested.get() && (lastMaintenance == Long.MIN_VALUE || now - lastMaintenance >= maintenanceIntervalMs)) {
            lastMaintenance = now;
            maintenance = runtime.runMaintenance();
        }
        return new TickOutcome(now, passes, maintenance);
    }

    /**
     * Ticks until {@link #requestStop()} is called. Each tick outcome with work in it is
     * handed to {@code sink}.
     */
    public void runLoop(Consumer<TickOutcome> sink) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already running");
        }
        try {
            runtime.recover();
            while (!stopRequested.get()) {
                TickOutcome outcome = tick();
                if (sink != null && !outcome.isEmpty()) {
                    sink.accept(outcome);
                }
                try {
                    Thread.sleep(IDLE_SLEEP_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            running.set(false);
        }
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean stopRequested() {
        return stopRequested.get();
    }

    public boolean running() {
        return running.get();
    }

    private static boolean due(Long last, long intervalMs, long now) {
        return last == null || now - last >= intervalMs;
    }

    public record TickOutcome(
            long tickedAtMs,
            List<SettlementRuntime.PassOutcome> passes,
            SettlementRuntime.MaintenanceOutcome maintenance
    ) {
        public boolean isEmpty() {
            return passes.isEmpty() && maintenance == null;
        }
    }
}
