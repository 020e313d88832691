package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.TerminalTable;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.ItemStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects deposits paid out twice. For every destination address, the expected balance is the
 * sum of units settled to it by processed deposits; an actual balance above that by more than
 * one part per million (at least one unit) is reported. Reports only; nothing is moved.
 */
public final class BalanceReconciler {
    static final long TOLERANCE_DIVISOR = 1_000_000L;

    private final ItemStore items;
    private final DestinationLedger destination;
    private final LedgerCallGuard calls;
    private final BridgeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private volatile BalanceReport last;

    public BalanceReconciler(
            ItemStore items,
            DestinationLedger destination,
            LedgerCallGuard calls,
            BridgeSettings settings,
            AuditLogger audit,
            Clock clock
    ) {
        this.items = items;
        this.destination = destination;
        this.calls = calls;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Runs {@link #reconcile()} when the last run is older than {@code balanceCheckIntervalMs},
     * otherwise returns the last report.
     */
    public BalanceReport reconcileIfDue() {
        BalanceReport report = last;
        if (report == null || clock.millis() - report.checkedAtMs() >= settings.balanceCheckIntervalMs()) {
            return reconcile();
        }
        return report;
    }

    public BalanceReport reconcile() {
        long now = clock.millis();
        Map<String, Long> expected = items.settledUnitsByDestination(ItemKind.DEPOSIT, TerminalTable.PROCESSED);
        List<BalanceReport.Discrepancy> discrepancies = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();
        long totalSurplus = 0L;
        for (Map.Entry<String, Long> e : expected.entrySet()) {
            String address = e.getKey();
            long actual;
            try {
                actual = calls.read(destination.name() + ".balanceUnits", () -> destination.balanceUnits(address));
            } catch (LedgerException ex) {
                unreadable.add(address);
                continue;
            }
            long want = e.getValue();
            long surplus = actual - want;
            if (surplus > tolerance(want)) {
                discrepancies.add(new BalanceReport.Discrepancy(address, want, actual, surplus));
                totalSurplus += surplus;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("address", address);
                details.put("expected_units", want);
                details.put("actual_units", actual);
                details.put("surplus_units", surplus);
                audit.log(AuditLogger.AuditEvent.of("balance.discrepancy", "balance/" + address, "surplus", details));
            }
        }
        BalanceReport report = new BalanceReport(now, expected.size(), discrepancies, totalSurplus, unreadable);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("checked_addresses", report.checkedAddresses());
        summary.put("discrepancies", discrepancies.size());
        summary.put("total_surplus_units", totalSurplus);
        summary.put("unreadable", unreadable);
        audit.log(AuditLogger.AuditEvent.of("balance.reconcile", "balance",
                report.clean() ? (unreadable.isEmpty() ? "ok" : "partial") : "discrepancy", summary));
        last = report;
        return report;
    }

    static long tolerance(long expectedUnits) {
        return Math.max(1L, expectedUnits / TOLERANCE_DIVISOR);
    }

    public BalanceReport lastReport() {
        return last;
    }
}
