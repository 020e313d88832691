package io.ledgerbridge.ledger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

final class TransferMemoTest {

    @Test
    void encodesActionAndItemId() {
        Assertions.assertEquals("payout:dep-1", TransferMemo.payout("dep-1"));
        Assertions.assertEquals("refund:cr-9", TransferMemo.refund("cr-9"));
        Assertions.assertEquals("quarantine:x", TransferMemo.quarantine("x"));
    }

    @Test
    void parsesOnlyEngineMemos() {
        Optional<TransferMemo> memo = TransferMemo.parse(" refund:abc:def ");
        Assertions.assertTrue(memo.isPresent());
        Assertions.assertEquals(TransferMemo.Action.REFUND, memo.get().action());
        Assertions.assertEquals("abc:def", memo.get().itemId());

        Assertions.assertTrue(TransferMemo.parse("dest:alice").isEmpty());
        Assertions.assertTrue(TransferMemo.parse("payout:").isEmpty());
        Assertions.assertTrue(TransferMemo.parse(":x").isEmpty());
        Assertions.assertTrue(TransferMemo.parse(null).isEmpty());
    }

    @Test
    void rejectsBlankItemId() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TransferMemo.payout(" "));
    }
}
