package io.ledgerbridge.settlement;

import io.ledgerbridge.ledger.AccountInfo;
import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.SourceLedger;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.ItemUpdate;
import io.ledgerbridge.model.SettlementItem;

import java.util.Optional;

/**
 * Source to destination: a deposit into the vault is paid out as newly issued units on the
 * destination ledger, to the account named in the deposit memo.
 */
public final class DepositProcessor extends DirectionProcessor {
    private final SourceLedger source;
    private final DestinationLedger destination;
    private final BackingGuard backing;

    public DepositProcessor(SettlementContext ctx, SourceLedger source, DestinationLedger destination, BackingGuard backing) {
        super(ItemKind.DEPOSIT, ctx);
        this.source = source;
        this.destination = destination;
        this.backing = backing;
    }

    @Override
    protected LedgerAdapter payoutLedger() {
        return destination;
    }

    @Override
    protected LedgerAdapter returnLedger() {
        return source;
    }

    @Override
    protected String quarantineAddress() {
        return ctx.settings().sourceQuarantineAddress();
    }

    @Override
    protected StepResult stepDirection(SettlementItem item) {
        return switch (item.status()) {
            case DETECTED -> validate(item);
            case READY_FOR_PROCESSING -> payout(item);
            default -> StepResult.WAITING;
        };
    }

    private StepResult validate(SettlementItem item) {
        FeeQuote quote;
        try {
            quote = ctx.feePolicy().quote(kind, item.grossUnits());
        } catch (ArithmeticException e) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error(UNREPRESENTABLE_AMOUNT));
        }
        if (quote.feeOnly()) {
            return finalizeFeeOnly(item, FeeKind.MICRO_FORFEIT, "below minimum or consumed by fees");
        }
        Optional<String> address = destinationFromMemo(item.memo(), ctx.settings().destinationMemoPrefix());
        if (address.isEmpty()) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED, ItemUpdate.error("memo does not name a destination account"));
        }
        Optional<AccountInfo> account;
        try {
            account = ctx.calls().read(destination.name() + ".lookupAccount",
                    () -> destination.lookupAccount(address.get()));
        } catch (LedgerException e) {
            return recordError(item, "destination lookup failed: " + e.getMessage());
        }
        if (account == null || account.isEmpty() || !account.get().holdsExpectedAsset()) {
            return moveTo(item, ItemStatus.TO_BE_REFUNDED,
                    ItemUpdate.error("destination account " + address.get() + " missing or incompatible"));
        }
        return moveTo(item, ItemStatus.READY_FOR_PROCESSING, ItemUpdate.destination(address.get()));
    }

    private StepResult payout(SettlementItem item) {
        if (backing.payoutsPaused()) {
            return recordError(item, "payouts paused: collateral check not healthy");
        }
        return submitPayout(item);
    }

    /**
     * Destination account from a memo of the form {@code <prefix><address>}.
     */
    static Optional<String> destinationFromMemo(String memo, String prefix) {
        if (memo == null) {
            return Optional.empty();
        }
        String trimmed = memo.trim();
        String p = prefix == null ? "" : prefix;
        if (!trimmed.startsWith(p)) {
            return Optional.empty();
        }
        String address = trimmed.substring(p.length()).trim();
        if (address.isEmpty() || address.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(address);
    }
}
