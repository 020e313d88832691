package io.ledgerbridge.settlement;

import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.model.FeeEntry;
import io.ledgerbridge.model.FeeKind;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.testing.TestBridge;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class FeePolicyTest {

    @Test
    void netIsGrossMinusFlatAndTruncatedDynamicFee() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-fees-net-");
        try {
            Map<String, Object> values = TestBridge.baseSettings();
            values.put("dynamicFeeBps", 30);
            FeePolicy policy = new FeePolicy(TestBridge.writeSettings(root, values));

            FeeQuote quote = policy.quote(ItemKind.DEPOSIT, 1_000_333L);
            Assertions.assertFalse(quote.feeOnly());
            Assertions.assertEquals(100_000L, quote.flatFee());
            Assertions.assertEquals(3_000L, quote.dynamicFee());
            Assertions.assertEquals(897_333L, quote.net());
            Assertions.assertEquals(897_333L, quote.payoutUnits());
            Assertions.assertEquals(quote.grossUnits(), quote.net() + quote.flatFee() + quote.dynamicFee());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void amountsAtOrBelowTheFeesAreFeeOnly() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-fees-micro-");
        try {
            FeePolicy policy = new FeePolicy(TestBridge.writeSettings(root, TestBridge.baseSettings()));
            Assertions.assertTrue(policy.quote(ItemKind.DEPOSIT, 100_100L).feeOnly(), "below minimum");
            Assertions.assertTrue(policy.quote(ItemKind.CREDIT, 0L).feeOnly());
            FeeQuote smallest = policy.quote(ItemKind.DEPOSIT, 100_101L);
            Assertions.assertFalse(smallest.feeOnly());
            Assertions.assertEquals(1L, smallest.payoutUnits());
            Assertions.assertEquals(0L, policy.quote(ItemKind.DEPOSIT, 50L).payoutUnits());
            Assertions.assertEquals(-99_950L, policy.returnNet(50L));
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void payoutIsRescaledBetweenLedgerDecimalsByTruncation() throws Exception {
        Path root = Files.createTempDirectory("ledgerbridge-test-fees-decimals-");
        try {
            Map<String, Object> values = TestBridge.baseSettings();
            values.put("sourceDecimals", 6);
            values.put("destinationDecimals", 8);
            values.put("creditMinimumUnits", 10_000_001);
            values.put("creditFlatFeeUnits", 10_000_000);
            BridgeSettings settings = TestBridge.writeSettings(root, values);
            FeePolicy policy = new FeePolicy(settings);

            Assertions.assertEquals(123_456_700L, policy.toPayoutUnits(ItemKind.DEPOSIT, 1_234_567L));
            FeeQuote credit = policy.quote(ItemKind.CREDIT, 100_000_099L);
            Assertions.assertEquals(90_000_099L, credit.net());
            Assertions.assertEquals(900_000L, credit.payoutUnits());

            FeeQuote dust = policy.quote(ItemKind.CREDIT, 10_000_050L);
            Assertions.assertTrue(dust.feeOnly(), "net rounds to zero source units");

            FeeEntry entry = policy.entry(ItemKind.CREDIT, "cr-1", FeeKind.FLAT, 10_000_000L, 7L);
            Assertions.assertEquals(10_000_000L, entry.destinationUnits());
            Assertions.assertEquals(100_000L, entry.sourceUnits());
        } finally {
            TestBridge.deleteRecursively(root);
        }
    }

    @Test
    void dynamicFeeUsesExactIntegerArithmetic() {
        Assertions.assertEquals(0L, FeePolicy.dynamicFee(3_333L, 2));
        Assertions.assertEquals(922_337_203_685_477L, FeePolicy.dynamicFee(Long.MAX_VALUE, 1));
        Assertions.assertEquals(0L, FeePolicy.dynamicFee(-5L, 100));
        Assertions.assertEquals(12L, FeePolicy.scale(1_299L, 8, 6));
        Assertions.assertThrows(ArithmeticException.class, () -> FeePolicy.scale(Long.MAX_VALUE, 0, 18));
    }
}
