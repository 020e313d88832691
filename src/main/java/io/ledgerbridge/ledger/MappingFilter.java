package io.ledgerbridge.ledger;

public record MappingFilter(String txId, String identity) {
}
