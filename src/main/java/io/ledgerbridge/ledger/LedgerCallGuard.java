package io.ledgerbridge.ledger;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs adapter calls on daemon worker threads with a hard timeout so a hung RPC can never
 * stall a pass. A timed-out submission is reported as {@link LedgerException.Kind#AMBIGUOUS};
 * a timed-out read is {@link LedgerException.Kind#TRANSIENT}.
 */
public final class LedgerCallGuard implements AutoCloseable {
    private final long timeoutMs;
    private final ExecutorService executor;

    public LedgerCallGuard(long timeoutMs) {
        this.timeoutMs = Math.max(1L, timeoutMs);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ledgerbridge-ledger-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T read(String operation, Callable<T> call) {
        return invoke(operation, call, LedgerException.Kind.TRANSIENT);
    }

    public <T> T submit(String operation, Callable<T> call) {
        return invoke(operation, call, LedgerException.Kind.AMBIGUOUS);
    }

    public void run(String operation, Runnable call) {
        invoke(operation, () -> {
            call.run();
            return null;
        }, LedgerException.Kind.TRANSIENT);
    }

    private <T> T invoke(String operation, Callable<T> call, LedgerException.Kind onTimeout) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LedgerException(onTimeout, operation + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LedgerException(onTimeout, operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LedgerException le) {
                throw le;
            }
            // unclassified adapter failure during a submission may still have landed
            throw new LedgerException(
                    onTimeout,
                    operation + " failed: " + (cause == null ? e.getMessage() : cause.getMessage()),
                    cause == null ? e : cause
            );
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
