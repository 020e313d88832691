package io.ledgerbridge.settlement;

import io.ledgerbridge.governor.AttemptGovernor;
import io.ledgerbridge.ledger.AccountInfo;
import io.ledgerbridge.ledger.Confirmation;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.TransferHandle;
import io.ledgerbridge.ledger.TransferMemo;
import io.ledgerbridge.ledger.TransferRequest;
import io.ledgerbridge.model.FeeEntry;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.model.SettlementItem;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.ReservationLease;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * State machine driver shared by both directions. Subclasses handle the statuses before
 * settlement; refunds, quarantine moves and outstanding-transfer confirmation live here.
 *
 * <p>Every step runs under the item's reservation and re-reads the row first, so a step
 * never acts on a stale status.
 */
public abstract class DirectionProcessor {

    public enum StepResult {
        /** The item changed status. */
        ADVANCED,
        /** Nothing to do yet; the item stays where it is. */
        WAITING,
        /** Reserved by someone else or no longer open. */
        SKIPPED
    }

    protected static final String UNREPRESENTABLE_AMOUNT = "amount cannot be represented on the payout ledger";

    protected final ItemKind kind;
    protected final SettlementContext ctx;

    protected DirectionProcessor(ItemKind kind, SettlementContext ctx) {
        this.kind = kind;
        this.ctx = ctx;
    }

    public ItemKind kind() {
        return kind;
    }

    /** Ledger receiving the payout. */
    protected abstract LedgerAdapter payoutLedger();

    /** Ledger the item was detected on; refunds and quarantine moves go back to it. */
    protected abstract LedgerAdapter returnLedger();

    protected abstract String quarantineAddress();

    protected abstract StepResult stepDirection(SettlementItem item);

    public final StepResult advance(SettlementItem queued) {
        Optional<ReservationLease> lease = ctx.reservations().tryReserve(
                kind,
                queued.txId(),
                ctx.holderId(),
                ctx.settings().reservationTtlMs(),
                now()
        );
        if (lease.isEmpty()) {
            return StepResult.SKIPPED;
        }
        try (ReservationLease held = lease.get()) {
            Optional<SettlementItem> fresh = ctx.items().findOpen(kind, held.key());
            if (fresh.isEmpty() || !fresh.get().status().isActionable()) {
                return StepResult.SKIPPED;
            }
            return step(fresh.get());
        }
    }

    private StepResult step(SettlementItem item) {
        return switch (item.status()) {
            case TO_BE_REFUNDED -> refund(item);
            case REFUND_SENT -> confirmTransfer(item, returnLedger(), ItemStatus.TO_BE_REFUNDED,
                    () -> settleReturn(item, ItemStatus.REFUNDED, FeeKind.REFUND_FLAT, TransferMemo.Action.REFUND));
            case AWAITING_CONFIRMATION -> confirmTransfer(item, payoutLedger(), ItemStatus.READY_FOR_PROCESSING,
                    () -> settlePayout(item));
            case TO_BE_QUARANTINED -> quarantine(item);
            case QUARANTINE_SENT -> confirmTransfer(item, returnLedger(), ItemStatus.TO_BE_QUARANTINED,
                    () -> settleReturn(item, ItemStatus.QUARANTINED, FeeKind.QUARANTINE_FLAT, TransferMemo.Action.QUARANTINE));
            default -> stepDirection(item);
        };
    }

    /**
     * Submits the net payout to {@link #payoutLedger()}. Exhausted attempts route the item to
     * refund.
     */
    protected StepResult submitPayout(SettlementItem item) {
        if (item.destinationAddress() == null || item.destinationAddress().isBlank()) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error("payout address lost"));
        }
        LedgerAdapter ledger = payoutLedger();
        FeeQuote quote = ctx.feePolicy().quote(kind, item.grossUnits());
        SubmitAttempt attempt = submitGoverned(item, TransferMemo.Action.PAYOUT, ledger,
                new TransferRequest(item.destinationAddress(), quote.payoutUnits(), TransferMemo.payout(item.txId())));
        return applySubmit(item, attempt, ItemStatus.AWAITING_CONFIRMATION, ItemStatus.TO_BE_REFUNDED);
    }

    private StepResult settlePayout(SettlementItem item) {
        long now = now();
        FeeQuote quote = ctx.feePolicy().quote(kind, item.grossUnits());
        List<FeeEntry> fees = new ArrayList<>();
        if (quote.flatFee() > 0L) {
            fees.add(ctx.feePolicy().entry(kind, item.txId(), FeeKind.FLAT, quote.flatFee(), now));
        }
        if (quote.dynamicFee() > 0L) {
            fees.add(ctx.feePolicy().entry(kind, item.txId(), FeeKind.DYNAMIC, quote.dynamicFee(), now));
        }
        if (!ctx.items().finalizeItem(kind, item.txId(), item.status(), ItemStatus.PROCESSED,
                quote.payoutUnits(), item.transferId(), fees, now)) {
            return StepResult.SKIPPED;
        }
        ctx.governor().reset(actionKey(TransferMemo.Action.PAYOUT, item.txId()));
        auditTransition(item, ItemStatus.PROCESSED, Map.of(
                "transfer_id", item.transferId(),
                "payout_units", quote.payoutUnits()
        ));
        return StepResult.ADVANCED;
    }

    private StepResult refund(SettlementItem item) {
        long net = ctx.feePolicy().returnNet(item.grossUnits());
        if (net <= 0L) {
            return finalizeFeeOnly(item, FeeKind.REFUND_FORFEIT, "refund fee consumes the amount");
        }
        LedgerAdapter ledger = returnLedger();
        if (item.senderAddress().isBlank()) {
            return moveTo(item, ItemStatus.TO_BE_QUARANTINED, ItemUpdate.error("sender address unknown"));
        }
        if (ctx.governor().attempts(actionKey(TransferMemo.Action.REFUND, item.txId())) == 0) {
            Optional<AccountInfo> account;
            try {
                account = ctx.calls().read(ledger.name() + ".lookupAccount",
                        () -> ledger.lookupAccount(item.senderAddress()));
            } catch (LedgerException e) {
                return recordError(item, "sender lookup failed: " + e.getMessage());
            }
            if (account == null || account.isEmpty() || !account.get().refundable()) {
                return moveTo(item, ItemStatus.TO_BE_QUARANTINED, ItemUpdate.error("sender account is not refundable"));
            }
        }
        SubmitAttempt attempt = submitGoverned(item, TransferMemo.Action.REFUND, ledger,
                new TransferRequest(item.senderAddress(), net, TransferMemo.refund(item.txId())));
        return applySubmit(item, attempt, ItemStatus.REFUND_SENT, ItemStatus.TO_BE_QUARANTINED);
    }

    private StepResult quarantine(SettlementItem item) {
        String address = quarantineAddress();
        if (address == null || address.isBlank()) {
            StepResult result = moveTo(item, ItemStatus.QUARANTINE_FAILED,
                    ItemUpdate.error("quarantine address not configured"));
            if (result == StepResult.ADVANCED) {
                alert(item, ItemStatus.QUARANTINE_FAILED, "quarantine address not configured");
            }
            return result;
        }
        long net = ctx.feePolicy().returnNet(item.grossUnits());
        if (net <= 0L) {
            return finalizeFeeOnly(item, FeeKind.REFUND_FORFEIT, "quarantine fee consumes the amount");
        }
        SubmitAttempt attempt = submitGoverned(item, TransferMemo.Action.QUARANTINE, returnLedger(),
                new TransferRequest(address, net, TransferMemo.quarantine(item.txId())));
        return applySubmit(item, attempt, ItemStatus.QUARANTINE_SENT, ItemStatus.QUARANTINE_FAILED);
    }

    private StepResult settleReturn(SettlementItem item, ItemStatus terminal, FeeKind feeKind, TransferMemo.Action action) {
        long now = now();
        long net = Math.max(0L, ctx.feePolicy().returnNet(item.grossUnits()));
        long fee = item.grossUnits() - net;
        List<FeeEntry> fees = fee > 0L
                ? List.of(ctx.feePolicy().entry(kind, item.txId(), feeKind, fee, now))
                : List.of();
        if (!ctx.items().finalizeItem(kind, item.txId(), item.status(), terminal, net, item.transferId(), fees, now)) {
            return StepResult.SKIPPED;
        }
        ctx.governor().reset(actionKey(action, item.txId()));
        auditTransition(item, terminal, Map.of("transfer_id", item.transferId(), "settled_units", net));
        return StepResult.ADVANCED;
    }

    /**
     * Polls the outstanding transfer. FAILED sends the item back to {@code retryStatus}; a
     * transfer still pending after the confirmation timeout needs an operator.
     */
    protected StepResult confirmTransfer(
            SettlementItem item,
            LedgerAdapter ledger,
            ItemStatus retryStatus,
            Supplier<StepResult> onConfirmed
    ) {
        if (!item.hasTransfer()) {
            return moveTo(item, retryStatus, ItemUpdate.clearedTransfer("outstanding transfer id missing"));
        }
        Confirmation confirmation;
        try {
            confirmation = ctx.calls().read(ledger.name() + ".confirm",
                    () -> ledger.confirm(new TransferHandle(item.transferId())));
        } catch (LedgerException e) {
            return recordError(item, "confirmation check failed: " + e.getMessage());
        }
        if (confirmation == null) {
            confirmation = Confirmation.PENDING;
        }
        switch (confirmation) {
            case CONFIRMED:
                return onConfirmed.get();
            case FAILED:
                return moveTo(item, retryStatus,
                        ItemUpdate.clearedTransfer("transfer " + item.transferId() + " failed on " + ledger.name()));
            default:
                long submittedAt = item.transferSubmittedAtMs() == null ? item.updatedAtMs() : item.transferSubmittedAtMs();
                if (now() - submittedAt > ctx.settings().confirmationTimeoutMs()) {
                    String reason = "transfer " + item.transferId() + " unconfirmed after "
                            + ctx.settings().confirmationTimeoutMs() + "ms";
                    StepResult result = moveTo(item, ItemStatus.NEEDS_RECONCILIATION, ItemUpdate.error(reason));
                    if (result == StepResult.ADVANCED) {
                        alert(item, ItemStatus.NEEDS_RECONCILIATION, reason);
                    }
                    return result;
                }
                return StepResult.WAITING;
        }
    }

    /**
     * Check, record, act. Once an attempt exists the engine first looks for its own memo on
     * the ledger, so an ambiguous earlier submission is adopted instead of repeated.
     */
    protected SubmitAttempt submitGoverned(
            SettlementItem item,
            TransferMemo.Action action,
            LedgerAdapter ledger,
            TransferRequest request
    ) {
        String key = actionKey(action, item.txId());
        int max = ctx.settings().maxActionAttempts();
        int previous = ctx.governor().attempts(key);
        if (previous > 0) {
            Optional<TransferHandle> found;
            try {
                found = ctx.calls().read(ledger.name() + ".findRecentTransferByMemo",
                        () -> ledger.findRecentTransferByMemo(request.memo(), ctx.settings().memoSearchLimit()));
            } catch (LedgerException e) {
                return SubmitAttempt.deferred(previous, "memo lookup failed: " + e.getMessage());
            }
            if (found != null && found.isPresent()) {
                return SubmitAttempt.recovered(found.get(), previous);
            }
        }
        AttemptGovernor.Decision decision = ctx.governor().evaluate(key, max);
        if (decision == AttemptGovernor.Decision.EXHAUSTED) {
            return SubmitAttempt.exhausted(previous, action.prefix() + " attempts exhausted");
        }
        if (decision == AttemptGovernor.Decision.COOLING_DOWN) {
            return SubmitAttempt.coolingDown(previous);
        }
        int attempt = ctx.governor().recordAttempt(key);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", action.prefix());
        details.put("ledger", ledger.name());
        details.put("to", request.toAddress());
        details.put("units", request.units());
        details.put("attempt", attempt);
        try {
            TransferHandle handle = ctx.calls().submit(ledger.name() + ".submitTransfer",
                    () -> ledger.submitTransfer(request));
            if (handle == null) {
                throw new LedgerException(LedgerException.Kind.AMBIGUOUS, "adapter returned no transfer handle");
            }
            details.put("transfer_id", handle.transferId());
            ctx.audit().log(AuditLogger.AuditEvent.forItem("transfer.submit", "ok", kind.label(), item.txId(), details));
            return SubmitAttempt.submitted(handle, attempt);
        } catch (LedgerException e) {
            details.put("failure", e.kind().name());
            details.put("error", String.valueOf(e.getMessage()));
            ctx.audit().log(AuditLogger.AuditEvent.forItem("transfer.submit", "failed", kind.label(), item.txId(), details));
            String error = action.prefix() + " attempt " + attempt + " " + e.kind().name().toLowerCase() + ": " + e.getMessage();
            if (e.ambiguous()) {
                return SubmitAttempt.ambiguous(attempt, error);
            }
            return attempt >= max ? SubmitAttempt.exhausted(attempt, error) : SubmitAttempt.failed(attempt, error);
        }
    }

    protected StepResult applySubmit(SettlementItem item, SubmitAttempt attempt, ItemStatus sentStatus, ItemStatus exhaustedStatus) {
        switch (attempt.outcome()) {
            case SUBMITTED:
            case RECOVERED: {
                long now = now();
                boolean moved = ctx.items().transition(kind, item.txId(), item.status(), sentStatus,
                        ItemUpdate.transfer(attempt.handle().transferId(), now), now);
                if (!moved) {
                    return StepResult.SKIPPED;
                }
                auditTransition(item, sentStatus, Map.of(
                        "transfer_id", attempt.handle().transferId(),
                        "recovered", attempt.outcome() == SubmitAttempt.Outcome.RECOVERED
                ));
                return StepResult.ADVANCED;
            }
            case EXHAUSTED: {
                StepResult result = moveTo(item, exhaustedStatus, ItemUpdate.error(attempt.error()));
                if (result == StepResult.ADVANCED && exhaustedStatus.isStuck()) {
                    alert(item, exhaustedStatus, attempt.error());
                }
                return result;
            }
            case COOLING_DOWN:
                return StepResult.WAITING;
            default:
                return recordError(item, attempt.error());
        }
    }

    protected StepResult finalizeFeeOnly(SettlementItem item, FeeKind feeKind, String reason) {
        long now = now();
        List<FeeEntry> fees = item.grossUnits() > 0L
                ? List.of(ctx.feePolicy().entry(kind, item.txId(), feeKind, item.grossUnits(), now))
                : List.of();
        if (!ctx.items().finalizeItem(kind, item.txId(), item.status(), ItemStatus.FEE_ONLY, 0L, null, fees, now)) {
            return StepResult.SKIPPED;
        }
        auditTransition(item, ItemStatus.FEE_ONLY, Map.of("reason", reason, "forfeited_units", item.grossUnits()));
        return StepResult.ADVANCED;
    }

    protected StepResult moveTo(SettlementItem item, ItemStatus next, ItemUpdate update) {
        if (!ctx.items().transition(kind, item.txId(), item.status(), next, update, now())) {
            return StepResult.SKIPPED;
        }
        auditTransition(item, next, update.lastError() == null ? Map.of() : Map.of("reason", update.lastError()));
        return StepResult.ADVANCED;
    }

    protected StepResult recordError(SettlementItem item, String error) {
        if (error != null && !error.equals(item.lastError())) {
            ctx.items().recordError(kind, item.txId(), item.status(), error, now());
        }
        return StepResult.WAITING;
    }

    protected void auditTransition(SettlementItem item, ItemStatus next, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", item.status().name());
        details.put("to", next.name());
        details.putAll(extra);
        ctx.audit().log(AuditLogger.AuditEvent.forItem("item.transition", "ok", kind.label(), item.txId(), details));
    }

    protected void alert(SettlementItem item, ItemStatus status, String reason) {
        ctx.audit().log(AuditLogger.AuditEvent.forItem(
                "operator.alert",
                status.name().toLowerCase(),
                kind.label(),
                item.txId(),
                Map.of("reason", reason == null ? "" : reason, "gross_units", item.grossUnits())
        ));
    }

    protected String actionKey(TransferMemo.Action action, String txId) {
        return kind.actionKey(action.prefix(), txId);
    }

    protected long now() {
        return ctx.clock().millis();
    }
}
