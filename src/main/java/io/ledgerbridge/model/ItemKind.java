package io.ledgerbridge.model;

/**
 * Direction of a settlement item.
 */
public enum ItemKind {
    /** Detected on the source ledger, paid out on the destination ledger. */
    DEPOSIT("deposits", ItemStatus.DETECTED),
    /** Detected on the destination ledger, paid out on the source ledger. */
    CREDIT("credits", ItemStatus.PENDING_MAPPING);

    private final String tablePrefix;
    private final ItemStatus initialStatus;

    ItemKind(String tablePrefix, ItemStatus initialStatus) {
        this.tablePrefix = tablePrefix;
        this.initialStatus = initialStatus;
    }

    public String tablePrefix() {
        return tablePrefix;
    }

    public String openTable() {
        return tablePrefix + "_open";
    }

    public String table(TerminalTable table) {
        return tablePrefix + "_" + table.suffix();
    }

    public ItemStatus initialStatus() {
        return initialStatus;
    }

    public String label() {
        return name().toLowerCase();
    }

    public String actionKey(String action, String itemId) {
        return label() + ":" + action + ":" + itemId;
    }

    public static ItemKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("item kind must not be blank");
        }
        String normalized = raw.trim().toUpperCase();
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return ItemKind.valueOf(normalized);
    }
}
