package io.ledgerbridge.ledger;

public record MappingRecord(String txId, String identity, String payoutAddress, long publishedAtMs) {

    /**
     * True when this record was published for the filter's transaction by the filter's sender.
     * A blank identity on either side never matches.
     */
    public boolean matches(MappingFilter filter) {
        return filter != null
                && txId != null && txId.equals(filter.txId())
                && identity != null && !identity.isBlank()
                && filter.identity() != null && identity.equals(filter.identity());
    }
}
