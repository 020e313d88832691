package io.ledgerbridge.ledger;

public enum Confirmation {
    CONFIRMED,
    PENDING,
    FAILED
}
