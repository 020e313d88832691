package io.ledgerbridge.ledger;

import io.ledgerbridge.model.ItemKind;

import java.util.Map;
import java.util.Optional;

/**
 * Register ledger issuing the bridged asset. It also hosts the out-of-band payout address
 * mappings, the published watermarks and the engine's liveness heartbeat.
 */
public interface DestinationLedger extends LedgerAdapter {

    long circulatingUnits();

    /**
     * Bridged-asset balance held by {@code address}, or 0 when the account is missing or holds
     * another asset.
     */
    long balanceUnits(String address);

    /**
     * Mapping published for {@code filter.txId()} by {@code filter.identity()}. Mappings
     * published by any other identity must not be returned.
     */
    Optional<MappingRecord> queryMapping(MappingFilter filter);

    void publishWatermarks(Map<ItemKind, Long> watermarks);

    Map<ItemKind, Long> fetchPublishedWatermarks();

    void publishHeartbeat(long timestampMs);
}
