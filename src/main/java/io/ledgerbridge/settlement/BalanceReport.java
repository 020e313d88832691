package io.ledgerbridge.settlement;

import java.util.List;

/**
 * Result of comparing payout-address balances on the destination ledger against the units
 * the engine has paid to them.
 *
 * @param unreadable addresses whose balance could not be read this run
 */
public record BalanceReport(
        long checkedAtMs,
        int checkedAddresses,
        List<Discrepancy> discrepancies,
        long totalSurplusUnits,
        List<String> unreadable
) {
    public BalanceReport {
        discrepancies = List.copyOf(discrepancies);
        unreadable = List.copyOf(unreadable);
    }

    public boolean clean() {
        return discrepancies.isEmpty();
    }

    public record Discrepancy(String address, long expectedUnits, long actualUnits, long surplusUnits) {
    }
}
