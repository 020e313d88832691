/**
 * Attempt bookkeeping for every external, fee-consuming action: payouts, refunds and
 * quarantine moves on either ledger.
 */
package io.ledgerbridge.governor;
