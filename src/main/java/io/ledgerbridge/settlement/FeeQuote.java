package io.ledgerbridge.settlement;

/**
 * Fee breakdown for one gross amount. {@code flatFee}, {@code dynamicFee} and {@code net} are
 * in the units of the ledger the item was detected on; {@code payoutUnits} is {@code net}
 * rescaled to the payout ledger.
 */
public record FeeQuote(
        long grossUnits,
        long flatFee,
        long dynamicFee,
        long net,
        long payoutUnits,
        boolean feeOnly
) {
}
