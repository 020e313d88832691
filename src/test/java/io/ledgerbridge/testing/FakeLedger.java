package io.ledgerbridge.testing;

import io.ledgerbridge.ledger.AccountInfo;
import io.ledgerbridge.ledger.Confirmation;
import io.ledgerbridge.ledger.LedgerAdapter;
import io.ledgerbridge.ledger.LedgerException;
import io.ledgerbridge.ledger.OutgoingTransfer;
import io.ledgerbridge.ledger.RawEvent;
import io.ledgerbridge.ledger.TransferHandle;
import io.ledgerbridge.ledger.TransferRequest;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory ledger. Transfers land with {@link #initialConfirmation} unless a queued
 * failure says otherwise.
 */
public class FakeLedger implements LedgerAdapter {
    private final String name;
    protected final Clock clock;
    private final List<RawEvent> events = new ArrayList<>();
    private final Map<String, Landed> transfers = new LinkedHashMap<>();
    private final Map<String, AccountInfo> accounts = new HashMap<>();
    private final Deque<SubmitFailure> submitFailures = new ArrayDeque<>();
    private final AtomicInteger submitCalls = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();
    private volatile Confirmation initialConfirmation = Confirmation.CONFIRMED;
    private volatile LedgerException readFailure;
    private volatile LedgerException fetchFailure;

    public FakeLedger(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    public synchronized void addEvent(RawEvent event) {
        events.add(event);
    }

    public synchronized void addAccount(String address, boolean holdsExpectedAsset, boolean refundable) {
        accounts.put(address, new AccountInfo(address, holdsExpectedAsset, refundable));
    }

    /** Next submission throws {@code failure} without landing. */
    public synchronized void failNextSubmit(LedgerException.Kind kind) {
        submitFailures.add(new SubmitFailure(kind, false));
    }

    /** Next submission lands on the ledger but the caller sees an ambiguous failure. */
    public synchronized void landNextSubmitThenTimeout() {
        submitFailures.add(new SubmitFailure(LedgerException.Kind.AMBIGUOUS, true));
    }

    public void setInitialConfirmation(Confirmation confirmation) {
        this.initialConfirmation = confirmation;
    }

    /** Confirms every transfer still pending on this ledger. */
    public synchronized void confirmPending() {
        for (Landed landed : transfers.values()) {
            if (landed.confirmation == Confirmation.PENDING) {
                landed.confirmation = Confirmation.CONFIRMED;
            }
        }
    }

    public void setReadFailure(LedgerException failure) {
        this.readFailure = failure;
    }

    public void setFetchFailure(LedgerException failure) {
        this.fetchFailure = failure;
    }

    /** Records a transfer as if it had been sent by an earlier engine run. */
    public synchronized String recordTransfer(String toAddress, long units, String memo, long timeMs) {
        String id = name + "-tx-" + sequence.incrementAndGet();
        transfers.put(id, new Landed(new OutgoingTransfer(id, toAddress, units, memo, timeMs), Confirmation.CONFIRMED));
        return id;
    }

    public synchronized List<OutgoingTransfer> transfers() {
        List<OutgoingTransfer> out = new ArrayList<>();
        transfers.values().forEach(t -> out.add(t.transfer));
        return out;
    }

    public synchronized List<OutgoingTransfer> transfersWithMemo(String memo) {
        List<OutgoingTransfer> out = new ArrayList<>();
        for (Landed t : transfers.values()) {
            if (t.transfer.memo().equals(memo)) {
                out.add(t.transfer);
            }
        }
        return out;
    }

    public int submitCalls() {
        return submitCalls.get();
    }

    @Override
    public synchronized List<RawEvent> fetchNewEvents(long sinceWatermarkMs) {
        if (fetchFailure != null) {
            throw fetchFailure;
        }
        List<RawEvent> out = new ArrayList<>();
        for (RawEvent event : events) {
            if (event.eventTimeMs() >= sinceWatermarkMs) {
                out.add(event);
            }
        }
        return out;
    }

    @Override
    public synchronized TransferHandle submitTransfer(TransferRequest request) {
        submitCalls.incrementAndGet();
        SubmitFailure failure = submitFailures.poll();
        if (failure != null && !failure.lands()) {
            throw new LedgerException(failure.kind(), name + " refused " + request.memo());
        }
        String id = recordTransfer(request.toAddress(), request.units(), request.memo(), clock.millis());
        transfers.get(id).confirmation = initialConfirmation;
        if (failure != null) {
            throw new LedgerException(failure.kind(), name + " lost the response for " + request.memo());
        }
        return new TransferHandle(id);
    }

    @Override
    public synchronized Confirmation confirm(TransferHandle handle) {
        checkRead();
        Landed landed = transfers.get(handle.transferId());
        return landed == null ? Confirmation.FAILED : landed.confirmation;
    }

    @Override
    public synchronized Optional<AccountInfo> lookupAccount(String address) {
        checkRead();
        return Optional.ofNullable(accounts.get(address));
    }

    @Override
    public synchronized Optional<TransferHandle> findRecentTransferByMemo(String memo, int searchLimit) {
        checkRead();
        List<Landed> all = new ArrayList<>(transfers.values());
        int seen = 0;
        for (int i = all.size() - 1; i >= 0 && seen < searchLimit; i--, seen++) {
            Landed t = all.get(i);
            if (t.transfer.memo().equals(memo) && t.confirmation != Confirmation.FAILED) {
                return Optional.of(new TransferHandle(t.transfer.transferId()));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<OutgoingTransfer> scanOutgoingTransfers(long sinceMs) {
        checkRead();
        List<OutgoingTransfer> out = new ArrayList<>();
        for (Landed t : transfers.values()) {
            if (t.transfer.timeMs() >= sinceMs) {
                out.add(t.transfer);
            }
        }
        return out;
    }

    protected void checkRead() {
        LedgerException failure = readFailure;
        if (failure != null) {
            throw failure;
        }
    }

    private record SubmitFailure(LedgerException.Kind kind, boolean lands) {
    }

    private static final class Landed {
        final OutgoingTransfer transfer;
        Confirmation confirmation;

        Landed(OutgoingTransfer transfer, Confirmation confirmation) {
            this.transfer = transfer;
            this.confirmation = confirmation;
        }
    }
}
