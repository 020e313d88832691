package io.ledgerbridge.model;

import java.util.EnumSet;
import java.util.Set;

public enum ItemStatus {
    DETECTED,
    PENDING_MAPPING,
    READY_FOR_PROCESSING,
    SENDING,
    AWAITING_CONFIRMATION,
    TO_BE_REFUNDED,
    REFUND_SENT,
    TO_BE_QUARANTINED,
    QUARANTINE_SENT,
    QUARANTINE_FAILED,
    NEEDS_RECONCILIATION,
    PROCESSED,
    FEE_ONLY,
    REFUNDED,
    QUARANTINED;

    private static final Set<ItemStatus> STUCK = EnumSet.of(QUARANTINE_FAILED, NEEDS_RECONCILIATION);

    /**
     * Statuses that leave the open table. The row is copied to {@link #terminalTable()}.
     */
    public boolean isTerminal() {
        return terminalTable() != null;
    }

    /**
     * Statuses that stay in the open table but need an operator; the engine never moves
     * them automatically.
     */
    public boolean isStuck() {
        return STUCK.contains(this);
    }

    public boolean isActionable() {
        return !isTerminal() && !isStuck();
    }

    public TerminalTable terminalTable() {
        return switch (this) {
            case PROCESSED, FEE_ONLY -> TerminalTable.PROCESSED;
            case REFUNDED -> TerminalTable.REFUNDED;
            case QUARANTINED -> TerminalTable.QUARANTINED;
            default -> null;
        };
    }

    public static Set<ItemStatus> actionable() {
        Set<ItemStatus> out = EnumSet.noneOf(ItemStatus.class);
        for (ItemStatus status : values()) {
            if (status.isActionable()) {
                out.add(status);
            }
        }
        return out;
    }

    public static Set<ItemStatus> stuck() {
        return EnumSet.copyOf(STUCK);
    }
}
