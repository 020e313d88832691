package io.ledgerbridge.testing;

import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.config.BridgeSettings;
import io.ledgerbridge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Temp data roots and settings files for tests.
 */
public final class TestBridge {
    public static final String DEST_ACCOUNT = "dst-alice";
    public static final String SOURCE_ACCOUNT = "src-alice";
    public static final String SOURCE_QUARANTINE = "src-quarantine";
    public static final String DEST_QUARANTINE = "dst-quarantine";

    private TestBridge() {
    }

    /**
     * Settings most flow tests start from: no cooldown, 1:1 decimals, 1.0 unit flat fees and
     * both quarantine addresses configured.
     */
    public static Map<String, Object> baseSettings() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("maxActionAttempts", 3);
        out.put("actionCooldownMs", 0);
        out.put("reservationTtlMs", 60_000);
        out.put("sourceDecimals", 6);
        out.put("destinationDecimals", 6);
        out.put("depositMinimumUnits", 100_101);
        out.put("depositFlatFeeUnits", 100_000);
        out.put("creditMinimumUnits", 100_101);
        out.put("creditFlatFeeUnits", 100_000);
        out.put("dynamicFeeBps", 0);
        out.put("refundFlatFeeUnits", 100_000);
        out.put("destinationMemoPrefix", "dest:");
        out.put("sourceQuarantineAddress", SOURCE_QUARANTINE);
        out.put("destinationQuarantineAddress", DEST_QUARANTINE);
        out.put("mappingTimeoutMs", 60_000);
        out.put("confirmationTimeoutMs", 120_000);
        out.put("watermarkSafetyMarginMs", 1_000);
        out.put("passTimeBudgetMs", 60_000);
        out.put("backingCheckIntervalMs", 0);
        out.put("ledgerCallTimeoutMs", 5_000);
        return out;
    }

    public static BridgeSettings writeSettings(Path root, Map<String, Object> values) throws IOException {
        BridgeConfig config = BridgeConfig.fromRoot(root.toString());
        Files.createDirectories(config.rootDir());
        Files.writeString(config.settingsFile(), Jsons.toJson(values), StandardCharsets.UTF_8);
        return BridgeSettings.load(config.settingsFile());
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
