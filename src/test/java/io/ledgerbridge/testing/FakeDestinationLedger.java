package io.ledgerbridge.testing;

import io.ledgerbridge.ledger.DestinationLedger;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.MappingFilter;
import io.ledgerbridge.ledger.MappingRecord;
import io.ledgerbridge.model.ItemKind;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class FakeDestinationLedger extends FakeLedger implements DestinationLedger {
    private final List<MappingRecord> mappings = new ArrayList<>();
    private final Map<ItemKind, Long> published = new EnumMap<>(ItemKind.class);
    private final List<Map<ItemKind, Long>> publishCalls = new ArrayList<>();
    private final List<Long> heartbeats = new ArrayList<>();
    private final Map<String, Long> balances = new HashMap<>();
    private int mappingQueries;
    private volatile long circulatingUnits;
    private volatile LedgerException publishFailure;
    private volatile LedgerException heartbeatFailure;

    public FakeDestinationLedger(Clock clock) {
        super("destination", clock);
    }

    public void setCirculatingUnits(long units) {
        this.circulatingUnits = units;
    }

    public synchronized void addMapping(MappingRecord mapping) {
        mappings.add(mapping);
    }

    public void setPublishFailure(LedgerException failure) {
        this.publishFailure = failure;
    }

    public synchronized void setPublished(ItemKind chain, long valueMs) {
        published.put(chain, valueMs);
    }

    public synchronized List<Map<ItemKind, Long>> publishCalls() {
        return new ArrayList<>(publishCalls);
    }

    public synchronized int mappingQueries() {
        return mappingQueries;
    }

    public synchronized void setBalance(String address, long units) {
        balances.put(address, units);
    }

    public void setHeartbeatFailure(LedgerException failure) {
        this.heartbeatFailure = failure;
    }

    public synchronized List<Long> heartbeats() {
        return new ArrayList<>(heartbeats);
    }

    @Override
    public long circulatingUnits() {
        checkRead();
        return circulatingUnits;
    }

    @Override
    public synchronized long balanceUnits(String address) {
        checkRead();
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized Optional<MappingRecord> queryMapping(MappingFilter filter) {
        checkRead();
        mappingQueries++;
        for (MappingRecord mapping : mappings) {
            if (mapping.txId().equals(filter.txId())) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void publishWatermarks(Map<ItemKind, Long> watermarks) {
        if (publishFailure != null) {
            throw publishFailure;
        }
        publishCalls.add(new EnumMap<>(watermarks));
        published.putAll(watermarks);
    }

    @Override
    public synchronized Map<ItemKind, Long> fetchPublishedWatermarks() {
        checkRead();
        return new EnumMap<>(published);
    }

    @Override
    public synchronized void publishHeartbeat(long timestampMs) {
        if (heartbeatFailure != null) {
            throw heartbeatFailure;
        }
        heartbeats.add(timestampMs);
    }
}
