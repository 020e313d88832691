package io.ledgerbridge.model;

public enum TerminalTable {
    PROCESSED("processed"),
    REFUNDED("refunded"),
    QUARANTINED("quarantined");

    private final String suffix;

    TerminalTable(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static TerminalTable parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("terminal table must not be blank");
        }
        return TerminalTable.valueOf(raw.trim().toUpperCase());
    }
}
