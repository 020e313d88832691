package io.ledgerbridge.model;

public record FeeSummary(
        ItemKind itemKind,
        FeeKind feeKind,
        long entryCount,
        long sourceUnits,
        long destinationUnits,
        long rebuiltAtMs
) {
}
