package io.ledgerbridge.ledger;

/**
 * Token-account ledger holding the vault collateral.
 */
public interface SourceLedger extends LedgerAdapter {

    long collateralUnits();
}
