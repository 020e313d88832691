package io.ledgerbridge.model;

/**
 * Row of a terminal table. Recovered rows were rebuilt from outgoing transfer memos and
 * carry no detection data.
 */
public record SettledItem(
        SettlementItem item,
        TerminalTable table,
        long settledUnits,
        String settledTransferId,
        long settledAtMs,
        boolean recovered
) {
}
