package io.ledgerbridge.ledger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class LedgerCallGuardTest {

    @Test
    void returnsValueFromWorkerThread() {
        try (LedgerCallGuard guard = new LedgerCallGuard(1_000L)) {
            String thread = guard.read("threadName", () -> Thread.currentThread().getName());
            Assertions.assertTrue(thread.startsWith("ledgerbridge-ledger-call-"));
        }
    }

    @Test
    void timedOutReadIsTransientAndTimedOutSubmitIsAmbiguous() {
        CountDownLatch never = new CountDownLatch(1);
        try (LedgerCallGuard guard = new LedgerCallGuard(50L)) {
            LedgerException read = Assertions.assertThrows(LedgerException.class, () -> guard.read("slow.read", () -> {
                never.await(5, TimeUnit.SECONDS);
                return 1;
            }));
            Assertions.assertEquals(LedgerException.Kind.TRANSIENT, read.kind());
            Assertions.assertTrue(read.getMessage().contains("slow.read"));

            LedgerException submit = Assertions.assertThrows(LedgerException.class, () -> guard.submit("slow.submit", () -> {
                never.await(5, TimeUnit.SECONDS);
                return 1;
            }));
            Assertions.assertEquals(LedgerException.Kind.AMBIGUOUS, submit.kind());
        }
    }

    @Test
    void adapterLedgerExceptionKeepsItsKind() {
        try (LedgerCallGuard guard = new LedgerCallGuard(1_000L)) {
            LedgerException e = Assertions.assertThrows(LedgerException.class, () -> guard.submit("reject", () -> {
                throw new LedgerException(LedgerException.Kind.REJECTED, "insufficient balance");
            }));
            Assertions.assertEquals(LedgerException.Kind.REJECTED, e.kind());
            Assertions.assertEquals("insufficient balance", e.getMessage());
        }
    }

    @Test
    void unclassifiedSubmitFailureIsAmbiguous() {
        try (LedgerCallGuard guard = new LedgerCallGuard(1_000L)) {
            LedgerException e = Assertions.assertThrows(LedgerException.class, () -> guard.submit("boom", () -> {
                throw new IllegalStateException("socket reset");
            }));
            Assertions.assertEquals(LedgerException.Kind.AMBIGUOUS, e.kind());
            Assertions.assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }
}
