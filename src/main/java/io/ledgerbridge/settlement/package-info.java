/**
 * Settlement state machines for both directions, plus fees, backing, watermarks and startup
 * recovery.
 */
package io.ledgerbridge.settlement;
