/**
 * LedgerBridge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ledgerbridge.Main} bootstraps the operator CLI.</li>
 *   <li>{@code io.ledgerbridge.runtime.SettlementRuntime} wires adapters, stores and both directions.</li>
 *   <li>{@code io.ledgerbridge.settlement.DirectionProcessor} is the shared item state machine driver.</li>
 *   <li>{@code io.ledgerbridge.storage.ItemStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.ledgerbridge;
