package io.ledgerbridge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.ledgerbridge.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolved engine settings. Every amount is in integer base units of the ledger named by the
 * setting; every duration is in milliseconds.
 *
 * <p>Fee settings for a direction are expressed in the units of the ledger the item was
 * detected on. {@code refundFlatFeeUnits} applies to refunds and quarantine moves on the
 * ledger the value is returned to.
 */
public record BridgeSettings(
        int maxActionAttempts,
        long actionCooldownMs,
        long reservationTtlMs,
        int sourceDecimals,
        int destinationDecimals,
        long depositMinimumUnits,
        long depositFlatFeeUnits,
        long creditMinimumUnits,
        long creditFlatFeeUnits,
        int dynamicFeeBps,
        long refundFlatFeeUnits,
        String destinationMemoPrefix,
        String sourceQuarantineAddress,
        String destinationQuarantineAddress,
        long mappingTimeoutMs,
        long confirmationTimeoutMs,
        long watermarkSafetyMarginMs,
        long maxWatermarkLookbackMs,
        long passTimeBudgetMs,
        int passVolumeLimit,
        int backingPauseThresholdBps,
        long backingCheckIntervalMs,
        long ledgerCallTimeoutMs,
        long detectionIntervalMs,
        long advancementIntervalMs,
        long maintenanceIntervalMs,
        int memoSearchLimit,
        long heartbeatMinIntervalMs,
        long balanceCheckIntervalMs
) {
    public static final int MAX_DECIMALS = 18;
    public static final int BPS_DENOMINATOR = 10_000;
    public static final long MIN_HEARTBEAT_INTERVAL_MS = 10_000L;

    public static BridgeSettings defaults() {
        return new BridgeSettings(
                3,
                300_000L,
                120_000L,
                6,
                6,
                100_101L,
                100_000L,
                100_101L,
                100_000L,
                0,
                100_000L,
                "dest:",
                "",
                "",
                1_800_000L,
                900_000L,
                1_000L,
                7L * 24L * 3_600_000L,
                8_000L,
                1_000,
                9_000,
                60_000L,
                15_000L,
                10_000L,
                10_000L,
                60_000L,
                50,
                60_000L,
                3_600_000L
        );
    }

    /**
     * Reads {@code file} over the defaults. A missing file yields the defaults; a malformed
     * file is an operator error and fails loudly.
     */
    public static BridgeSettings load(Path file) {
        BridgeSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        return fromFile(Jsons.readFile(file, SettingsFile.class), defaults);
    }

    static BridgeSettings fromFile(SettingsFile file, BridgeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int sourceDecimals = clampInt(file.sourceDecimals(), defaults.sourceDecimals(), 0, MAX_DECIMALS);
        int destinationDecimals = clampInt(file.destinationDecimals(), defaults.destinationDecimals(), 0, MAX_DECIMALS);
        long depositFlatFee = sanitizeLong(file.depositFlatFeeUnits(), defaults.depositFlatFeeUnits(), 0L);
        long creditFlatFee = sanitizeLong(file.creditFlatFeeUnits(), defaults.creditFlatFeeUnits(), 0L);
        long passTimeBudget = sanitizeLong(file.passTimeBudgetMs(), defaults.passTimeBudgetMs(), 100L);
        long ledgerCallTimeout = sanitizeLong(file.ledgerCallTimeoutMs(), defaults.ledgerCallTimeoutMs(), 100L);
        return new BridgeSettings(
                sanitizeInt(file.maxActionAttempts(), defaults.maxActionAttempts(), 1),
                sanitizeLong(file.actionCooldownMs(), defaults.actionCooldownMs(), 0L),
                sanitizeLong(file.reservationTtlMs(), defaults.reservationTtlMs(), 1_000L),
                sourceDecimals,
                destinationDecimals,
                sanitizeLong(file.depositMinimumUnits(), defaults.depositMinimumUnits(), 1L),
                depositFlatFee,
                sanitizeLong(file.creditMinimumUnits(), defaults.creditMinimumUnits(), 1L),
                creditFlatFee,
                clampInt(file.dynamicFeeBps(), defaults.dynamicFeeBps(), 0, BPS_DENOMINATOR),
                sanitizeLong(file.refundFlatFeeUnits(), defaults.refundFlatFeeUnits(), 0L),
                sanitizeText(file.destinationMemoPrefix(), defaults.destinationMemoPrefix()),
                sanitizeText(file.sourceQuarantineAddress(), defaults.sourceQuarantineAddress()),
                sanitizeText(file.destinationQuarantineAddress(), defaults.destinationQuarantineAddress()),
                sanitizeLong(file.mappingTimeoutMs(), defaults.mappingTimeoutMs(), 1_000L),
                sanitizeLong(file.confirmationTimeoutMs(), defaults.confirmationTimeoutMs(), 1_000L),
                sanitizeLong(file.watermarkSafetyMarginMs(), defaults.watermarkSafetyMarginMs(), 0L),
                sanitizeLong(file.maxWatermarkLookbackMs(), defaults.maxWatermarkLookbackMs(), 60_000L),
                passTimeBudget,
                sanitizeInt(file.passVolumeLimit(), defaults.passVolumeLimit(), 1),
                clampInt(file.backingPauseThresholdBps(), defaults.backingPauseThresholdBps(), 0, 100 * BPS_DENOMINATOR),
                sanitizeLong(file.backingCheckIntervalMs(), defaults.backingCheckIntervalMs(), 0L),
                ledgerCallTimeout,
                sanitizeLong(file.detectionIntervalMs(), defaults.detectionIntervalMs(), 100L),
                sanitizeLong(file.advancementIntervalMs(), defaults.advancementIntervalMs(), 100L),
                sanitizeLong(file.maintenanceIntervalMs(), defaults.maintenanceIntervalMs(), 100L),
                sanitizeInt(file.memoSearchLimit(), defaults.memoSearchLimit(), 1),
                sanitizeLong(file.heartbeatMinIntervalMs(), defaults.heartbeatMinIntervalMs(), MIN_HEARTBEAT_INTERVAL_MS),
                sanitizeLong(file.balanceCheckIntervalMs(), defaults.balanceCheckIntervalMs(), 0L)
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int clampInt(Integer raw, int fallback, int min, int max) {
        if (raw == null) {
            return fallback;
        }
        return Math.min(max, Math.max(min, raw));
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxActionAttempts,
            Long actionCooldownMs,
            Long reservationTtlMs,
            Integer sourceDecimals,
            Integer destinationDecimals,
            Long depositMinimumUnits,
            Long depositFlatFeeUnits,
            Long creditMinimumUnits,
            Long creditFlatFeeUnits,
            Integer dynamicFeeBps,
            Long refundFlatFeeUnits,
            String destinationMemoPrefix,
            String sourceQuarantineAddress,
            String destinationQuarantineAddress,
            Long mappingTimeoutMs,
            Long confirmationTimeoutMs,
            Long watermarkSafetyMarginMs,
            Long maxWatermarkLookbackMs,
            Long passTimeBudgetMs,
            Integer passVolumeLimit,
            Integer backingPauseThresholdBps,
            Long backingCheckIntervalMs,
            Long ledgerCallTimeoutMs,
            Long detectionIntervalMs,
            Long advancementIntervalMs,
            Long maintenanceIntervalMs,
            Integer memoSearchLimit,
            Long heartbeatMinIntervalMs,
            Long balanceCheckIntervalMs
    ) {
    }
}
