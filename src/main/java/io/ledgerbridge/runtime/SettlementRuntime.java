package io.ledgerbridge.runtime;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.RawEvent;
import io.ledgerbridge.ledger.SourceLedger;
import io.ledgerbridge.model.FeeSummary;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.SettlementItem;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.settlement.BackingGuard;
import io.ledgerbridge.settlement.BalanceReconciler;
import io.ledgerbridge.settlement.BalanceReport;
import io.ledgerbridge.settlement.BackingSnapshot;
import io.ledgerbridge.settlement.CreditProcessor;
import io.ledgerbridge.settlement.DepositProcessor;
import io.ledgerbridge.settlement.DirectionProcessor;
import io.ledgerbridge.settlement.FeePolicy;
import io.ledgerbridge.settlement.HeartbeatPublisher;
import io.ledgerbridge.settlement.PassBudget;
import io.ledgerbridge.settlement.SettlementContext;
import io.ledgerbridge.settlement.StartupRecovery;
import io.ledgerbridge.settlement.WatermarkManager;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Wires the stores, the two direction processors and the chain adapters, and exposes the
 * passes the scheduler drives. Expected per-item failures are counted in the outcome
 * records, never thrown.
 */
public final class SettlementRuntime implements AutoCloseable {
    private static final Comparator<RawEvent> EVENT_ORDER =
            Comparator.comparingLong(RawEvent::eventTimeMs)
                    .thenComparing(RawEvent::txId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final BridgeStores stores;
    private final SourceLedger source;
    private final DestinationLedger destination;
    private final Clock clock;
    private final String holderId;
    private final LedgerCallGuard calls;
    private BackingGuard backing;
    private HeartbeatPublisher heartbeat;
    private BalanceReconciler balances;
    private WatermarkManager watermarkManager;
    private StartupRecovery recovery;
    private Map<ItemKind, DirectionProcessor> processors;

    public SettlementRuntime(BridgeConfig config, SourceLedger source, DestinationLedger destination) {
        this(config, BridgeSettings.load(config.settingsFile()), source, destination, Clock.systemUTC());
    }

    public SettlementRuntime(
            BridgeConfig config,
            BridgeSettings settings,
            SourceLedger source,
            DestinationLedger destination,
            Clock clock
    ) {
        this.stores = new BridgeStores(config, settings, clock);
        this.source = source;
        this.destination = destination;
        this.clock = clock;
        this.holderId = "engine-" + UUID.randomUUID();
        this.calls = new LedgerCallGuard(settings.ledgerCallTimeoutMs());
    }

    public synchronized void init() {
        if (processors != null) {
            return;
        }
        stores.init();
        BridgeSettings settings = stores.settings();
        AuditLogger audit = stores.audit();
        SettlementContext ctx = new SettlementContext(
                settings,
                stores.items(),
                stores.reservations(),
                stores.governor(),
                new FeePolicy(settings),
                calls,
                audit,
                clock,
                holderId
        );
        backing = new BackingGuard(source, destination, calls, settings, audit, clock);
        heartbeat = new HeartbeatPublisher(destination, calls, settings, audit, clock);
        balances = new BalanceReconciler(stores.items(), destination, calls, settings, audit, clock);
        watermarkManager = new WatermarkManager(stores.items(), stores.watermarks(), destination, calls, settings, audit, clock);
        recovery = new StartupRecovery(stores.items(), stores.watermarks(), source, destination, calls, settings, audit, clock);
        Map<ItemKind, DirectionProcessor> map = new EnumMap<>(ItemKind.class);
        map.put(ItemKind.DEPOSIT, new DepositProcessor(ctx, source, destination, backing));
        map.put(ItemKind.CREDIT, new CreditProcessor(ctx, source, destination));
        processors = map;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("holder", holderId);
        details.put("source", source.name());
        details.put("destination", destination.name());
        details.put("settings", settings);
        audit.log(AuditLogger.AuditEvent.of("runtime.start", "runtime", "ok", details));
    }

    public BridgeStores stores() {
        return stores;
    }

    public String holderId() {
        return holderId;
    }

    public StartupRecovery.RecoveryOutcome recover() {
        init();
        return recovery.run();
    }

    public PassOutcome runDetectionPass(ItemKind kind) {
        return runDetectionPass(kind, () -> false);
    }

    /**
     * Fetches new events for {@code kind} since its scan watermark and records each one
     * exactly once, oldest event first. Known events are counted without spending the pass
     * budget. Events the pass fetched but did not store hold the chain's watermark below them.
     */
    public PassOutcome runDetectionPass(ItemKind kind, BooleanSupplier stop) {
        init();
        long started = clock.millis();
        LedgerAdapter ledger = kind == ItemKind.DEPOSIT ? source : destination;
        long since = watermarkManager.scanFrom(kind);
        List<RawEvent> events;
        try {
            events = calls.read(ledger.name() + ".fetchNewEvents", () -> ledger.fetchNewEvents(since));
        } catch (LedgerException e) {
            stores.audit().log(AuditLogger.AuditEvent.of("detection.failed", "detection/" + kind.label(), "failed",
                    Map.of("since_ms", since, "error", String.valueOf(e.getMessage()))));
            return PassOutcome.failed("detection", kind, started, clock.millis(), e.getMessage());
        }
        List<RawEvent> ordered = new ArrayList<>();
        for (RawEvent event : events == null ? List.<RawEvent>of() : events) {
            if (event != null) {
                ordered.add(event);
            }
        }
        ordered.sort(EVENT_ORDER);
        PassBudget budget = budget(stop);
        int inserted = 0;
        int duplicates = 0;
        int errored = 0;
        long unstoredFrom = Long.MAX_VALUE;
        for (RawEvent event : ordered) {
            try {
                if (event.txId() != null && stores.items().knows(kind, event.txId())) {
                    duplicates++;
                    continue;
                }
                if (!budget.tryAdmit()) {
                    unstoredFrom = Math.min(unstoredFrom, event.eventTimeMs());
                    break;
                }
                if (stores.items().insertDetected(kind, event, clock.millis())) {
                    inserted++;
                } else {
                    duplicates++;
                }
            } catch (RuntimeException e) {
                errored++;
                unstoredFrom = Math.min(unstoredFrom, event.eventTimeMs());
                auditItemError(kind, event.txId(), "detection", e);
            }
        }
        if (unstoredFrom == Long.MAX_VALUE) {
            watermarkManager.releaseFloor(kind);
        } else {
            watermarkManager.holdBelow(kind, unstoredFrom);
        }
        return new PassOutcome(
                "detection",
                kind.label(),
                budget.admitted(),
                inserted,
                duplicates,
                0,
                errored,
                budget.stopReason().name(),
                started,
                clock.millis(),
                ""
        );
    }

    public PassOutcome runAdvancementPass(ItemKind kind) {
        return runAdvancementPass(kind, () -> false);
    }

    /**
     * Moves queued items of {@code kind} through the state machine, oldest event first, then
     * proposes the chain's next watermark.
     */
    public PassOutcome runAdvancementPass(ItemKind kind, BooleanSupplier stop) {
        init();
        long started = clock.millis();
        if (kind == ItemKind.DEPOSIT) {
            backing.refreshIfDue();
        }
        DirectionProcessor processor = processors.get(kind);
        PassBudget budget = budget(stop);
        List<SettlementItem> queue = stores.items().listOpen(kind, ItemStatus.actionable(), stores.settings().passVolumeLimit());
        int advanced = 0;
        int waiting = 0;
        int skipped = 0;
        int errored = 0;
        for (SettlementItem item : queue) {
            if (!budget.tryAdmit()) {
                break;
            }
            try {
                switch (processor.advance(item)) {
                    case ADVANCED -> advanced++;
                    case WAITING -> waiting++;
                    default -> skipped++;
                }
            } catch (RuntimeException e) {
                errored++;
                auditItemError(kind, item.txId(), "advancement", e);
            }
        }
        String error = "";
        try {
            watermarkManager.propose(kind);
        } catch (RuntimeException e) {
            error = "watermark proposal failed: " + e.getMessage();
        }
        return new PassOutcome(
                "advancement",
                kind.label(),
                budget.admitted(),
                advanced,
                skipped,
                waiting,
                errored,
                budget.stopReason().name(),
                started,
                clock.millis(),
                error
        );
    }

    /**
     * Reservation sweep, watermark commit, fee summary rebuild, backing check and the
     * operator alert list.
     */
    public MaintenanceOutcome runMaintenance() {
        init();
        long now = clock.millis();
        int swept = stores.reservations().sweepExpired(now);
        WatermarkManager.WatermarkCommit commit = watermarkManager.commit();
        List<FeeSummary> feeSummary = stores.fees().rebuildSummary(now);
        BackingSnapshot snapshot = backing.check();
        List<BridgeStores.StuckItem> stuck = stores.stuckItems();
        for (BridgeStores.StuckItem item : stuck) {
            stores.audit().log(AuditLogger.AuditEvent.forItem(
                    "operator.alert",
                    item.status().toLowerCase(),
                    item.kind(),
                    item.txId(),
                    Map.of("reason", item.lastError() == null ? "" : item.lastError(), "gross_units", item.grossUnits())
            ));
        }
        HeartbeatPublisher.Beat beat = heartbeat.publishIfDue();
        BalanceReport balance = balances.reconcileIfDue();
        return new MaintenanceOutcome(swept, commit, feeSummary.size(), snapshot, stuck, beat, balance);
    }

    /**
     * Compares payout-address balances with processed deposits now, regardless of the
     * configured interval.
     */
    public BalanceReport reconcileBalances() {
        init();
        return balances.reconcile();
    }

    public StatsOutcome stats() {
        init();
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        for (ItemKind kind : ItemKind.values()) {
            counts.put(kind.label(), stores.items().countsByStatus(kind));
        }
        Map<String, Long> committed = new LinkedHashMap<>();
        watermarkManager.committed().forEach((k, v) -> committed.put(k.label(), v));
        return new StatsOutcome(
                counts,
                stores.reservations().countLive(clock.millis()),
                committed,
                backing.lastSnapshot(),
                backing.payoutsPaused()
        );
    }

    public List<BridgeStores.StuckItem> alerts() {
        init();
        return new ArrayList<>(stores.stuckItems());
    }

    public BridgeStores.RequeueOutcome requeueQuarantine(ItemKind kind, String txId) {
        init();
        return stores.requeueQuarantine(kind, txId, "operator");
    }

    private PassBudget budget(BooleanSupplier stop) {
        return new PassBudget(clock, stores.settings().passTimeBudgetMs(), stores.settings().passVolumeLimit(), stop);
    }

    private void auditItemError(ItemKind kind, String txId, String phase, RuntimeException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("phase", phase);
        details.put("error_type", e.getClass().getSimpleName());
        details.put("error", String.valueOf(e.getMessage()));
        stores.audit().log(AuditLogger.AuditEvent.forItem("item.error", "errored", kind.label(), txId, details));
    }

    @Override
    public void close() {
        calls.close();
    }

    /**
     * @param processed items admitted under the pass budget
     * @param progressed newly inserted (detection) or advanced (advancement)
     * @param unchanged duplicates (detection) or skipped (advancement)
     */
    public record PassOutcome(
            String pass,
            String kind,
            int processed,
            int progressed,
            int unchanged,
            int waiting,
            int errored,
            String stopReason,
            long startedAtMs,
            long finishedAtMs,
            String error
    ) {
        static PassOutcome failed(String pass, ItemKind kind, long started, long finished, String error) {
            return new PassOutcome(pass, kind.label(), 0, 0, 0, 0, 0, PassBudget.StopReason.NONE.name(),
                    started, finished, error == null ? "" : error);
        }
    }

    public record MaintenanceOutcome(
            int reservationsSwept,
            WatermarkManager.WatermarkCommit watermarks,
            int feeSummaryRows,
            BackingSnapshot backing,
            List<BridgeStores.StuckItem> alerts,
            HeartbeatPublisher.Beat heartbeat,
            BalanceReport balances
    ) {
    }

    public record StatsOutcome(
            Map<String, Map<String, Long>> itemsByStatus,
            long liveReservations,
            Map<String, Long> watermarks,
            BackingSnapshot backing,
            boolean payoutsPaused
    ) {
    }
}
