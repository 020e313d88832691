package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.observability.AuditLogger;

import java.time.Clock;
import java.util.Map;

/**
 * Publishes the engine's liveness timestamp on the destination ledger, at most once per
 * {@code heartbeatMinIntervalMs}. A failed publish does not start the interval, so the next
 * maintenance pass tries again.
 */
public final class HeartbeatPublisher {
    private final DestinationLedger destination;
    private final LedgerCallGuard calls;
    private final BridgeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private volatile long lastPublishedMs = -1L;

    public HeartbeatPublisher(
            DestinationLedger destination,
            LedgerCallGuard calls,
            BridgeSettings settings,
            AuditLogger audit,
            Clock clock
    ) {
        this.destination = destination;
        this.calls = calls;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    public Beat publishIfDue() {
        long now = clock.millis();
        long last = lastPublishedMs;
        if (last >= 0L && now - last < settings.heartbeatMinIntervalMs()) {
            return new Beat(false, last, "");
        }
        try {
            calls.run(destination.name() + ".publishHeartbeat", () -> destination.publishHeartbeat(now));
        } catch (LedgerException e) {
            String error = String.valueOf(e.getMessage());
            audit.log(AuditLogger.AuditEvent.of("heartbeat", "heartbeat", "failed",
                    Map.of("last_published_ms", last, "error", error)));
            return new Beat(false, last, error);
        }
        lastPublishedMs = now;
        return new Beat(true, now, "");
    }

    public long lastPublishedMs() {
        return lastPublishedMs;
    }

    /**
     * @param lastPublishedMs -1 until the first successful publish
     */
    public record Beat(boolean published, long lastPublishedMs, String error) {
    }
}
