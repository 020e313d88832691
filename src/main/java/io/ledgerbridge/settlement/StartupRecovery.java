package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.OutgoingTransfer;
import io.ledgerbridge.ledger.SourceLedger;
import io.ledgerbridge.ledger.TransferMemo;
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

/**
 * Rebuilds processed markers from the engine's own outgoing transfers. Every memo found on a
 * ledger names the item it settled; items the store does not know get an additive terminal
 * marker so a replayed detection event cannot be paid a second time.
 */
public final class StartupRecovery {
    private final ItemStore items;
    private final WatermarkStore watermarks;
    private final SourceLedger source;
    private final DestinationLedger destination;
    private final LedgerCallGuard calls;
    private final BridgeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;

    public StartupRecovery(
            ItemStore items,
            WatermarkStore watermarks,
            SourceLedger source,
            DestinationLedger destination,
            LedgerCallGuard calls,
            BridgeSettings settings,
            AuditLogger audit,
            Clock clock
    ) {
        this.items = items;
        this.watermarks = watermarks;
        this.source = source;
        this.destination = destination;
        this.calls = calls;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    public RecoveryOutcome run() {
        long now = clock.millis();
        List<String> errors = new ArrayList<>();
        Map<ItemKind, Long> committed = watermarks.committed();
        boolean seeded = false;
        if (committed.isEmpty()) {
            try {
                Map<ItemKind, Long> published = calls.read(destination.name() + ".fetchPublishedWatermarks",
                        destination::fetchPublishedWatermarks);
                if (published != null && !published.isEmpty()) {
                    Map<ItemKind, Long> seed = new EnumMap<>(published);
                    watermarks.commitAndClear(seed, List.of(), now);
                    committed = watermarks.committed();
                    seeded = true;
                }
            } catch (LedgerException e) {
                errors.add("published watermarks unavailable: " + e.getMessage());
            }
        }
        long floor = Math.max(0L, now - settings.maxWatermarkLookbackMs());
        long since = committed.values().stream().mapToLong(Long::longValue).min().orElse(floor);
        since = Math.max(floor, since);

        Tally tally = new Tally();
        scan(destination, since, ItemKind.DEPOSIT, ItemKind.CREDIT, tally, errors);
        scan(source, since, ItemKind.CREDIT, ItemKind.DEPOSIT, tally, errors);

        RecoveryOutcome outcome = new RecoveryOutcome(
                since,
                seeded,
                tally.scanned,
                tally.markers,
                tally.alreadyKnown,
                tally.foreign,
                tally.recovered,
                errors
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("since_ms", since);
        details.put("seeded_from_chain", seeded);
        details.put("scanned", tally.scanned);
        details.put("markers", tally.markers);
        details.put("errors", errors);
        audit.log(AuditLogger.AuditEvent.of("recovery.summary", "recovery", errors.isEmpty() ? "ok" : "partial", details));
        return outcome;
    }

    /**
     * Transfers from {@code ledger} carry payouts for {@code payoutKind} and returns for
     * {@code returnKind}.
     */
    private void scan(
            LedgerAdapter ledger,
            long since,
            ItemKind payoutKind,
            ItemKind returnKind,
            Tally tally,
            List<String> errors
    ) {
        List<OutgoingTransfer> transfers;
        try {
            transfers = calls.read(ledger.name() + ".scanOutgoingTransfers", () -> ledger.scanOutgoingTransfers(since));
        } catch (LedgerException e) {
            errors.add(ledger.name() + " scan failed: " + e.getMessage());
            return;
        }
        if (transfers == null) {
            return;
        }
        for (OutgoingTransfer transfer : transfers) {
            tally.scanned++;
            Optional<TransferMemo> memo = TransferMemo.parse(transfer.memo());
            if (memo.isEmpty()) {
                tally.foreign++;
                continue;
            }
            ItemKind kind;
            ItemStatus terminal;
            switch (memo.get().action()) {
                case PAYOUT -> {
                    kind = payoutKind;
                    terminal = ItemStatus.PROCESSED;
                }
                case REFUND -> {
                    kind = returnKind;
                    terminal = ItemStatus.REFUNDED;
                }
                default -> {
                    kind = returnKind;
                    terminal = ItemStatus.QUARANTINED;
                }
            }
            String itemId = memo.get().itemId();
            if (items.knows(kind, itemId)) {
                tally.alreadyKnown++;
                continue;
            }
            if (items.insertRecoveredMarker(kind, itemId, terminal, transfer.transferId(), transfer.toAddress(),
                    transfer.units(), transfer.timeMs(), clock.millis())) {
                tally.markers++;
                tally.recovered.add(kind.label() + ":" + itemId);
            } else {
                tally.alreadyKnown++;
            }
        }
    }

    private static final class Tally {
        int scanned;
        int markers;
        int alreadyKnown;
        int foreign;
        final List<String> recovered = new ArrayList<>();
    }

    public record RecoveryOutcome(
            long scannedSinceMs,
            boolean watermarksSeededFromChain,
            int transfersScanned,
            int markersInserted,
            int alreadyKnown,
            int foreignMemos,
            List<String> recoveredItems,
            List<String> errors
    ) {
    }
}
