/**
 * Runtime orchestration package.
 *
 * <p>{@link io.ledgerbridge.runtime.SettlementRuntime} wires the stores, the chain adapters
 * and both direction processors. {@link io.ledgerbridge.runtime.PollScheduler} drives its
 * detection, advancement and maintenance passes; {@link io.ledgerbridge.runtime.BridgeStores}
 * is the adapter-free view used by the operator CLI.
 */
package io.ledgerbridge.runtime;
