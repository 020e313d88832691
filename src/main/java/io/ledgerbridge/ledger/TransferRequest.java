package io.ledgerbridge.ledger;

public record TransferRequest(String toAddress, long units, String memo) {
    public TransferRequest {
        if (toAddress == null || toAddress.isBlank()) {
            throw new IllegalArgumentException("toAddress must not be blank");
        }
        if (units <= 0L) {
            throw new IllegalArgumentException("units must be > 0: " + units);
        }
    }
}
