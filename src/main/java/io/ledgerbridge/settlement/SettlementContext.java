package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.governor.AttemptGovernor;
import io.ledgerbridge.ledger.LedgerCallGuard;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.storage.ItemStore;
import io.ledgerbridge.storage.ReservationStore;

import java.time.Clock;

/**
 * Collaborators shared by both direction processors.
 *
 * @param holderId reservation holder token of this engine instance
 */
public record SettlementContext(
        BridgeSettings settings,
        ItemStore items,
        ReservationStore reservations,
        AttemptGovernor governor,
        FeePolicy feePolicy,
        LedgerCallGuard calls,
        AuditLogger audit,
        Clock clock,
        String holderId
) {
}
