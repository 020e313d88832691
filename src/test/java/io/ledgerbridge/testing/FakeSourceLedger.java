package io.ledgerbridge.testing;

import io.ledgerbridge.ledger.SourceLedger;

import java.time.Clock;

public final class FakeSourceLedger extends FakeLedger implements SourceLedger {
    private volatile long collateralUnits = Long.MAX_VALUE / 4;

    public FakeSourceLedger(Clock clock) {
        super("source", clock);
    }

    public void setCollateralUnits(long units) {
        this.collateralUnits = units;
    }

    @Override
    public long collateralUnits() {
        checkRead();
        return collateralUnits;
    }
}
