package io.ledgerbridge.settlement;

import io.ledgerbridge.ledger.AccountInfo;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.MappingFilter;
import io.ledgerbridge.ledger.MappingRecord;
import io.ledgerbridge.ledger.SourceLedger;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.model.SettlementItem;

import java.util.Optional;

/**
 * Destination to source: units sent to the engine on the destination ledger are redeemed
 * from the vault on the source ledger. The payout address is published out-of-band by the
 * depositor and must match both the transaction id and the depositor identity.
 */
public final class CreditProcessor extends DirectionProcessor {
    private final SourceLedger source;
    private final DestinationLedger destination;

    public CreditProcessor(SettlementContext ctx, SourceLedger source, DestinationLedger destination) {
        super(ItemKind.CREDIT, ctx);
        this.source = source;
        this.destination = destination;
    }

    @Override
    protected LedgerAdapter payoutLedger() {
        return source;
    }

    @Override
    protected LedgerAdapter returnLedger() {
        return destination;
    }

    @Override
    protected String quarantineAddress() {
        return ctx.settings().destinationQuarantineAddress();
    }

    @Override
    protected StepResult stepDirection(SettlementItem item) {
        return switch (item.status()) {
            case PENDING_MAPPING -> resolveMapping(item);
            case READY_FOR_PROCESSING -> startSending(item);
            case SENDING -> submitPayout(item);
            default -> StepResult.WAITING;
        };
    }

    private StepResult resolveMapping(SettlementItem item) {
        FeeQuote quote;
        try {
            quote = ctx.feePolicy().quote(kind, item.grossUnits());
        } catch (ArithmeticException e) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error(UNREPRESENTABLE_AMOUNT));
        }
        if (quote.feeOnly()) {
            return finalizeFeeOnly(item, FeeKind.MICRO_FORFEIT, "below minimum or consumed by fees");
        }
        if (item.senderIdentity() == null || item.senderIdentity().isBlank()) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error("sender identity not verified"));
        }
        MappingFilter filter = new MappingFilter(item.txId(), item.senderIdentity());
        Optional<MappingRecord> mapping = Optional.empty();
        String lookupError = null;
        try {
            Optional<MappingRecord> found = ctx.calls().read(destination.name() + ".queryMapping",
                    () -> destination.queryMapping(filter));
            if (found != null) {
                mapping = found.filter(m -> m.matches(filter)
                        && m.payoutAddress() != null
                        && !m.payoutAddress().isBlank());
            }
        } catch (LedgerException e) {
            lookupError = "mapping lookup failed: " + e.getMessage();
        }
        if (mapping.isPresent()) {
            String address = mapping.get().payoutAddress().trim();
            Optional<AccountInfo> account;
            try {
                account = ctx.calls().read(source.name() + ".lookupAccount", () -> source.lookupAccount(address));
            } catch (LedgerException e) {
                return recordError(item, "payout account lookup failed: " + e.getMessage());
            }
            if (account == null || account.isEmpty() || !account.get().holdsExpectedAsset()) {
                return moveTo(item, ItemStatus.TO_BE_REFUNDED,
                        ItemUpdate.error("payout account " + address + " missing or incompatible"));
            }
            return moveTo(item, ItemStatus.READY_FOR_PROCESSING, ItemUpdate.destination(address));
        }
        if (now() - item.detectedAtMs() >= ctx.settings().mappingTimeoutMs()) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error("no payout mapping within "
                    + ctx.settings().mappingTimeoutMs() + "ms"));
        }
        return lookupError == null ? StepResult.WAITING : recordError(item, lookupError);
    }

    private StepResult startSending(SettlementItem item) {
        StepResult moved = moveTo(item, ItemStatus.SENDING, ItemUpdate.none());
        if (moved != StepResult.ADVANCED) {
            return moved;
        }
        Optional<SettlementItem> sending = ctx.items().findOpen(kind, item.txId());
        if (sending.isEmpty() || sending.get().status() != ItemStatus.SENDING) {
            return StepResult.ADVANCED;
        }
        submitPayout(sending.get());
        return StepResult.ADVANCED;
    }
}
