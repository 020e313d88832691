package io.ledgerbridge.ledger;

public record OutgoingTransfer(String transferId, String toAddress, long units, String memo, long timeMs) {
}
