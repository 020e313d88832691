package io.ledgerbridge.model;

import java.util.Objects;

public record FeeEntry(
        ItemKind itemKind,
        String itemId,
        FeeKind feeKind,
        long sourceUnits,
        long destinationUnits,
        long createdAtMs
) {
    public FeeEntry {
        Objects.requireNonNull(itemKind, "itemKind");
        Objects.requireNonNull(feeKind, "feeKind");
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
        if (sourceUnits < 0L || destinationUnits < 0L) {
            throw new IllegalArgumentException("fee units must be >= 0");
        }
    }
}
