package io.ledgerbridge.model;

/**
 * Field changes applied together with a status transition. Null fields keep the stored
 * value, except {@code lastError} which is always written.
 */
public record ItemUpdate(
        String destinationAddress,
        String transferId,
        Long transferSubmittedAtMs,
        boolean clearTransfer,
        String lastError
) {
    public static ItemUpdate none() {
        return new ItemUpdate(null, null, null, false, null);
    }

    public static ItemUpdate error(String message) {
        return new ItemUpdate(null, null, null, false, message);
    }

    public static ItemUpdate destination(String address) {
        return new ItemUpdate(address, null, null, false, null);
    }

    public static ItemUpdate transfer(String transferId, long submittedAtMs) {
        return new ItemUpdate(null, transferId, submittedAtMs, false, null);
    }

    public static ItemUpdate clearedTransfer(String message) {
        return new ItemUpdate(null, null, null, true, message);
    }
}
