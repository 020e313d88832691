package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.ItemStore;
import io.ledgerbridge.storage.WatermarkStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per-chain scan watermarks. Advancement passes propose, maintenance commits. A committed
 * value only moves forward and is published on the destination ledger before it is stored.
 */
public final class WatermarkManager {
    private final ItemStore items;
    private final WatermarkStore store;
    private final DestinationLedger destination;
    private final LedgerCallGuard calls;
    private final BridgeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;

    public WatermarkManager(
            ItemStore items,
            WatermarkStore store,
            DestinationLedger destination,
            LedgerCallGuard calls,
            BridgeSettings settings,
            AuditLogger audit,
            Clock clock
    ) {
        this.items = items;
        this.store = store;
        this.destination = destination;
        this.calls = calls;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Start of the next detection scan: the committed watermark, never further back than the
     * maximum lookback.
     */
    public long scanFrom(ItemKind chain) {
        long floor = Math.max(0L, clock.millis() - settings.maxWatermarkLookbackMs());
        return Math.max(floor, store.committed(chain).orElse(0L));
    }

    /**
     * Proposes {@code oldest open event - margin}, or {@code newest known event - margin}
     * when nothing is open. Items parked for an operator do not hold the watermark back; a
     * held detection floor does. Returns the proposed value, or -1 when the chain has never
     * seen an event.
     */
    public long propose(ItemKind chain) {
        OptionalLong oldest = items.oldestOpenEventTime(chain, ItemStatus.stuck());
        OptionalLong anchor = oldest.isPresent() ? oldest : items.newestEventTime(chain);
        Optional<Long> floor = store.floor(chain);
        if (floor.isPresent()) {
            anchor = OptionalLong.of(anchor.isPresent() ? Math.min(anchor.getAsLong(), floor.get()) : floor.get());
        }
        if (anchor.isEmpty()) {
            return -1L;
        }
        long value = Math.max(0L, anchor.getAsLong() - settings.watermarkSafetyMarginMs());
        store.propose(chain, value, clock.millis());
        return value;
    }

    /**
     * Commits every proposal that does not move its chain backwards. Smaller proposals are
     * rejected and dropped. The advanced set is published in one destination write; if that
     * write fails nothing is stored and the proposals stay for the next run.
     */
    public WatermarkCommit commit() {
        Map<ItemKind, Long> proposals = store.proposals();
        Map<ItemKind, Long> committed = store.committed();
        Map<ItemKind, Long> advanced = new EnumMap<>(ItemKind.class);
        List<ItemKind> rejected = new ArrayList<>();
        for (Map.Entry<ItemKind, Long> e : proposals.entrySet()) {
            Long current = committed.get(e.getKey());
            if (current == null || e.getValue() >= current) {
                advanced.put(e.getKey(), e.getValue());
            } else {
                rejected.add(e.getKey());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("proposed_ms", e.getValue());
                details.put("committed_ms", current);
                audit.log(AuditLogger.AuditEvent.of("watermark.rejected", "watermark/" + e.getKey().label(), "rejected", details));
            }
        }
        long now = clock.millis();
        if (advanced.isEmpty()) {
            if (!rejected.isEmpty()) {
                store.commitAndClear(Map.of(), rejected, now);
            }
            return new WatermarkCommit(false, Map.of(), rejected, merged(committed, Map.of()), "");
        }
        try {
            Map<ItemKind, Long> publish = new EnumMap<>(advanced);
            calls.run(destination.name() + ".publishWatermarks", () -> destination.publishWatermarks(publish));
        } catch (LedgerException e) {
            audit.log(AuditLogger.AuditEvent.of("watermark.commit", "watermarks", "failed",
                    Map.of("error", String.valueOf(e.getMessage()), "pending", labels(advanced))));
            return new WatermarkCommit(false, Map.of(), rejected, merged(committed, Map.of()), String.valueOf(e.getMessage()));
        }
        List<ItemKind> consumed = new ArrayList<>(advanced.keySet());
        consumed.addAll(rejected);
        store.commitAndClear(advanced, consumed, now);
        audit.log(AuditLogger.AuditEvent.of("watermark.commit", "watermarks", "ok", Map.of("committed", labels(advanced))));
        return new WatermarkCommit(true, labels(advanced), rejected, merged(committed, advanced), "");
    }

    /**
     * A detection pass stopped before storing the event at {@code eventTimeMs}; proposals for
     * the chain stay below it until a later pass stores everything it fetched.
     */
    public void holdBelow(ItemKind chain, long eventTimeMs) {
        store.holdFloor(chain, eventTimeMs, clock.millis());
    }

    public void releaseFloor(ItemKind chain) {
        store.releaseFloor(chain);
    }

    public Map<ItemKind, Long> committed() {
        return store.committed();
    }

    public Map<ItemKind, Long> proposals() {
        return store.proposals();
    }

    private static Map<String, Long> labels(Map<ItemKind, Long> values) {
        Map<String, Long> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.label(), v));
        return out;
    }

    private static Map<String, Long> merged(Map<ItemKind, Long> committed, Map<ItemKind, Long> advanced) {
        Map<ItemKind, Long> all = new EnumMap<>(ItemKind.class);
        all.putAll(committed);
        advanced.forEach((k, v) -> all.merge(k, v, Math::max));
        return labels(all);
    }

    /**
     * @param published whether a destination write happened
     * @param advanced  chains moved forward by this commit, keyed by label
     * @param watermarks committed values after this commit, keyed by label
     */
    public record WatermarkCommit(
            boolean published,
            Map<String, Long> advanced,
            List<ItemKind> rejected,
            Map<String, Long> watermarks,
            String error
    ) {
    }
}
