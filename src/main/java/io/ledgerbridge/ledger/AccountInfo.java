package io.ledgerbridge.ledger;

/**
 * @param holdsExpectedAsset the account can receive the bridged asset
 * @param refundable         value may be returned to this account
 */
public record AccountInfo(String address, boolean holdsExpectedAsset, boolean refundable) {
}
