package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.SourceLedger;
import io.ledgerbridge.observability.AuditLogger;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compares vault collateral on the source ledger against the destination supply. New
 * deposit payouts stay paused while the last check breached the threshold, failed, or has
 * not run yet. Refunds, quarantine moves and confirmations are never gated here.
 */
public final class BackingGuard {
    private final SourceLedger source;
    private final DestinationLedger destination;
    private final LedgerCallGuard calls;
    private final BridgeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private volatile BackingSnapshot last;

    public BackingGuard(
            SourceLedger source,
            DestinationLedger destination,
            LedgerCallGuard calls,
            BridgeSettings settings,
            AuditLogger audit,
            Clock clock
    ) {
        this.source = source;
        this.destination = destination;
        this.calls = calls;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    public BackingSnapshot check() {
        long now = clock.millis();
        BackingSnapshot snapshot;
        try {
            long collateral = calls.read(source.name() + ".collateralUnits", source::collateralUnits);
            long circulating = calls.read(destination.name() + ".circulatingUnits", destination::circulatingUnits);
            snapshot = evaluate(collateral, circulating, now);
        } catch (LedgerException e) {
            snapshot = BackingSnapshot.unavailable(e.getMessage(), now);
        } catch (ArithmeticException e) {
            snapshot = BackingSnapshot.unavailable("supply out of range: " + e.getMessage(), now);
        }
        BackingSnapshot previous = last;
        last = snapshot;
        if (previous == null || previous.healthy() != snapshot.healthy()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("collateral_units", snapshot.collateralUnits());
            details.put("liability_source_units", snapshot.liabilitySourceUnits());
            details.put("ratio_bps", snapshot.ratioBps());
            details.put("threshold_bps", settings.backingPauseThresholdBps());
            details.put("error", snapshot.error() == null ? "" : snapshot.error());
            audit.log(AuditLogger.AuditEvent.of(
                    snapshot.healthy() ? "backing.restored" : "backing.breach",
                    "backing",
                    snapshot.available() ? (snapshot.breached() ? "breached" : "ok") : "unavailable",
                    details
            ));
        }
        return snapshot;
    }

    BackingSnapshot evaluate(long collateral, long circulating, long nowMs) {
        long liability = FeePolicy.scale(circulating, settings.destinationDecimals(), settings.sourceDecimals());
        BigInteger lhs = BigInteger.valueOf(collateral).multiply(BigInteger.valueOf(BridgeSettings.BPS_DENOMINATOR));
        BigInteger rhs = BigInteger.valueOf(settings.backingPauseThresholdBps()).multiply(BigInteger.valueOf(liability));
        boolean breached = lhs.compareTo(rhs) < 0;
        long ratio = liability <= 0L
                ? -1L
                : lhs.divide(BigInteger.valueOf(liability)).min(BigInteger.valueOf(Long.MAX_VALUE)).longValue();
        return new BackingSnapshot(true, collateral, circulating, liability, ratio, breached, null, nowMs);
    }

    public void refreshIfDue() {
        BackingSnapshot snapshot = last;
        if (snapshot == null || clock.millis() - snapshot.checkedAtMs() >= settings.backingCheckIntervalMs()) {
            check();
        }
    }

    public boolean payoutsPaused() {
        BackingSnapshot snapshot = last;
        return snapshot == null || !snapshot.healthy();
    }

    public BackingSnapshot lastSnapshot() {
        return last;
    }
}
