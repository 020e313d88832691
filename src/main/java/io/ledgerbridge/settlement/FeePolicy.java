package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.model.FeeEntry;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.ItemKind;

import java.math.BigInteger;

/**
 * Integer fee arithmetic. Every division and decimal rescale truncates toward zero, so the
 * engine never pays out a fraction of a base unit it did not receive.
 */
public final class FeePolicy {
    private static final BigInteger BPS = BigInteger.valueOf(BridgeSettings.BPS_DENOMINATOR);

    private final BridgeSettings settings;

    public FeePolicy(BridgeSettings settings) {
        this.settings = settings;
    }

    public FeeQuote quote(ItemKind kind, long grossUnits) {
        long minimum = kind == ItemKind.DEPOSIT ? settings.depositMinimumUnits() : settings.creditMinimumUnits();
        long flat = kind == ItemKind.DEPOSIT ? settings.depositFlatFeeUnits() : settings.creditFlatFeeUnits();
        long dynamic = dynamicFee(grossUnits, settings.dynamicFeeBps());
        long net = grossUnits - flat - dynamic;
        long payout = net > 0L ? toPayoutUnits(kind, net) : 0L;
        boolean feeOnly = grossUnits < minimum || net <= 0L || payout <= 0L;
        if (feeOnly) {
            return new FeeQuote(grossUnits, 0L, 0L, 0L, 0L, true);
        }
        return new FeeQuote(grossUnits, flat, dynamic, net, payout, false);
    }

    /**
     * Amount returned by a refund or quarantine move, in detection-ledger units. May be
     * zero or negative when the fee consumes the whole amount.
     */
    public long returnNet(long grossUnits) {
        return grossUnits - settings.refundFlatFeeUnits();
    }

    public static long dynamicFee(long grossUnits, int bps) {
        if (grossUnits <= 0L || bps <= 0) {
            return 0L;
        }
        return BigInteger.valueOf(grossUnits)
                .multiply(BigInteger.valueOf(bps))
                .divide(BPS)
                .longValueExact();
    }

    public long toPayoutUnits(ItemKind kind, long detectionUnits) {
        return kind == ItemKind.DEPOSIT
                ? scale(detectionUnits, settings.sourceDecimals(), settings.destinationDecimals())
                : scale(detectionUnits, settings.destinationDecimals(), settings.sourceDecimals());
    }

    /**
     * Fee entry for an amount in the units of the ledger {@code kind} was detected on, with
     * both unit systems filled in.
     */
    public FeeEntry entry(ItemKind kind, String itemId, FeeKind feeKind, long detectionUnits, long nowMs) {
        long other = toPayoutUnits(kind, detectionUnits);
        long sourceUnits = kind == ItemKind.DEPOSIT ? detectionUnits : other;
        long destinationUnits = kind == ItemKind.DEPOSIT ? other : detectionUnits;
        return new FeeEntry(kind, itemId, feeKind, sourceUnits, destinationUnits, nowMs);
    }

    public static long scale(long units, int fromDecimals, int toDecimals) {
        if (fromDecimals == toDecimals) {
            return units;
        }
        BigInteger factor = BigInteger.TEN.pow(Math.abs(toDecimals - fromDecimals));
        BigInteger value = BigInteger.valueOf(units);
        BigInteger scaled = toDecimals > fromDecimals ? value.multiply(factor) : value.divide(factor);
        return scaled.longValueExact();
    }
}
