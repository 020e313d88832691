package io.ledgerbridge.model;

import java.util.Objects;

/**
 * One detected chain transaction moving through its direction's state machine.
 *
 * <p>{@code transferId} and {@code transferSubmittedAtMs} describe the outstanding transfer
 * for the current status: the payout while awaiting confirmation, the refund while
 * {@link ItemStatus#REFUND_SENT}, the quarantine move while {@link ItemStatus#QUARANTINE_SENT}.
 */
public record SettlementItem(
        ItemKind kind,
        String txId,
        long eventTimeMs,
        long detectedAtMs,
        String senderAddress,
        String senderIdentity,
        long grossUnits,
        String memo,
        ItemStatus status,
        String destinationAddress,
        String transferId,
        Long transferSubmittedAtMs,
        String lastError,
        long updatedAtMs
) {
    public SettlementItem {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        if (txId == null || txId.isBlank()) {
            throw new IllegalArgumentException("txId must not be blank");
        }
        if (grossUnits < 0L) {
            throw new IllegalArgumentException("grossUnits must be >= 0: " + grossUnits);
        }
        senderAddress = senderAddress == null ? "" : senderAddress;
        senderIdentity = senderIdentity == null ? "" : senderIdentity;
        memo = memo == null ? "" : memo;
    }

    public boolean hasTransfer() {
        return transferId != null && !transferId.isBlank();
    }
}
