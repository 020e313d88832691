package io.ledgerbridge.settlement;

/**
 * One collateral check. {@code ratioBps} is -1 when there is no outstanding liability.
 */
public record BackingSnapshot(
        boolean available,
        long collateralUnits,
        long liabilityDestinationUnits,
        long liabilitySourceUnits,
        long ratioBps,
        boolean breached,
        String error,
        long checkedAtMs
) {
    public static BackingSnapshot unavailable(String error, long checkedAtMs) {
        return new BackingSnapshot(false, 0L, 0L, 0L, 0L, false, error, checkedAtMs);
    }

    public boolean healthy() {
        return available && !breached;
    }
}
