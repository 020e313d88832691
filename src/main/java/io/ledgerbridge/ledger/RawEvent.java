package io.ledgerbridge.ledger;

public record RawEvent(
        String txId,
        long eventTimeMs,
        String senderAddress,
        String senderIdentity,
        long grossUnits,
        String memo
) {
}
