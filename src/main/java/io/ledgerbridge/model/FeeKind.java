package io.ledgerbridge.model;

public enum FeeKind {
    FLAT,
    DYNAMIC,
    /** Whole gross kept because the item was below the minimum or nets to zero. */
    MICRO_FORFEIT,
    REFUND_FLAT,
    /** Whole gross kept because the refund fee consumed it. */
    REFUND_FORFEIT,
    QUARANTINE_FLAT
}
