package io.ledgerbridge.ledger;

public record TransferHandle(String transferId) {
    public TransferHandle {
        if (transferId == null || transferId.isBlank()) {
            throw new IllegalArgumentException("transferId must not be blank");
        }
    }
}
