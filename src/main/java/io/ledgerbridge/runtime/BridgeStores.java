package io.ledgerbridge.runtime;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.governor.AttemptGovernor;
import io.ledgerbridge.ledger.TransferMemo;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.model.SettlementItem;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.AttemptStore;
import io.ledgerbridge.storage.Database;
import io.ledgerbridge.storage.FeeLedgerStore;
import io.ledgerbridge.storage.ItemStore;
import io.ledgerbridge.storage.ReservationStore;
import io.ledgerbridge.storage.WatermarkStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The persistent side of the engine without any chain adapter: enough for the operator CLI
 * and shared by {@link SettlementRuntime}.
 */
public final class BridgeStores {
    private static final int ALERT_LIST_LIMIT = 500;

    private final BridgeConfig config;
    private final BridgeSettings settings;
    private final Clock clock;
    private final Database database;
    private final ItemStore items;
    private final ReservationStore reservations;
    private final AttemptStore attempts;
    private final AttemptGovernor governor;
    private final WatermarkStore watermarks;
    private final FeeLedgerStore fees;
    private AuditLogger auditLogger;

    public BridgeStores(BridgeConfig config, BridgeSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.items = new ItemStore(database);
        this.reservations = new ReservationStore(database);
        this.attempts = new AttemptStore(database);
        this.governor = new AttemptGovernor(attempts, settings.actionCooldownMs(), clock);
        this.watermarks = new WatermarkStore(database);
        this.fees = new FeeLedgerStore(database);
    }

    /**
     * Loads {@link BridgeSettings} from the data root's settings file.
     */
    public static BridgeStores open(BridgeConfig config, Clock clock) {
        return new BridgeStores(config, BridgeSettings.load(config.settingsFile()), clock);
    }

    public void init() {
        database.init();
        if (auditLogger == null) {
            auditLogger = new AuditLogger(config.auditFile(), clock);
        }
    }

    public BridgeConfig config() {
        return config;
    }

    public BridgeSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public ItemStore items() {
        return items;
    }

    public ReservationStore reservations() {
        return reservations;
    }

    public AttemptGovernor governor() {
        return governor;
    }

    public WatermarkStore watermarks() {
        return watermarks;
    }

    public FeeLedgerStore fees() {
        return fees;
    }

    public AuditLogger audit() {
        if (auditLogger == null) {
            throw new IllegalStateException("stores not initialized");
        }
        return auditLogger;
    }

    /**
     * Open items that need an operator, oldest first.
     */
    public List<StuckItem> stuckItems() {
        List<StuckItem> out = new ArrayList<>();
        for (ItemKind kind : ItemKind.values()) {
            for (SettlementItem item : items.listOpen(kind, ItemStatus.stuck(), ALERT_LIST_LIMIT)) {
                out.add(new StuckItem(
                        kind.label(),
                        item.txId(),
                        item.status().name(),
                        item.grossUnits(),
                        item.transferId(),
                        item.lastError(),
                        item.updatedAtMs()
                ));
            }
        }
        return out;
    }

    /**
     * Sends a {@code QUARANTINE_FAILED} item back to the quarantine queue with a fresh attempt
     * budget, after the operator has fixed the cause.
     */
    public RequeueOutcome requeueQuarantine(ItemKind kind, String txId, String actor) {
        Optional<SettlementItem> item = items.findOpen(kind, txId);
        if (item.isEmpty()) {
            return new RequeueOutcome(kind.label(), txId, false, "item is not open");
        }
        if (item.get().status() != ItemStatus.QUARANTINE_FAILED) {
            return new RequeueOutcome(kind.label(), txId, false, "status is " + item.get().status().name());
        }
        long now = clock.millis();
        if (!items.transition(kind, txId, ItemStatus.QUARANTINE_FAILED, ItemStatus.TO_BE_QUARANTINED,
                ItemUpdate.error("requeued by operator"), now)) {
            return new RequeueOutcome(kind.label(), txId, false, "status changed concurrently");
        }
        governor.reset(kind.actionKey(TransferMemo.Action.QUARANTINE.prefix(), txId));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", ItemStatus.QUARANTINE_FAILED.name());
        details.put("to", ItemStatus.TO_BE_QUARANTINED.name());
        audit().log(new AuditLogger.AuditEvent(
                "item.requeue",
                actor == null || actor.isBlank() ? "operator" : actor,
                kind.label() + "/" + txId,
                "ok",
                kind.label(),
                txId,
                details
        ));
        return new RequeueOutcome(kind.label(), txId, true, "requeued for quarantine");
    }

    public record StuckItem(
            String kind,
            String txId,
            String status,
            long grossUnits,
            String transferId,
            String lastError,
            long updatedAtMs
    ) {
    }

    public record RequeueOutcome(String kind, String txId, boolean requeued, String message) {
    }
}
