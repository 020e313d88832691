package io.ledgerbridge.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed status transitions per direction.
 *
 * <p>Deposit lifecycle:
 * <pre>
 * DETECTED -> READY_FOR_PROCESSING -> AWAITING_CONFIRMATION -> PROCESSED
 *    |               |                        |
 *    +-> FEE_ONLY    +-> TO_BE_REFUNDED <-----+ (FAILED goes back to READY_FOR_PROCESSING)
 *                            |
 *                            +-> REFUND_SENT -> REFUNDED
 *                            +-> TO_BE_QUARANTINED -> QUARANTINE_SENT -> QUARANTINED
 *                                        |
 *                                        +-> QUARANTINE_FAILED
 * </pre>
 *
 * <p>Credits start in PENDING_MAPPING and pass through SENDING between
 * READY_FOR_PROCESSING and AWAITING_CONFIRMATION; the refund and quarantine branches are
 * shared. Any status with an outstanding transfer may end in NEEDS_RECONCILIATION.
 */
public final class ItemStateMachine {
    private static final Map<ItemKind, Map<ItemStatus, Set<ItemStatus>>> ALLOWED_TRANSITIONS = buildTransitions();

    private ItemStateMachine() {
    }

    private static Map<ItemKind, Map<ItemStatus, Set<ItemStatus>>> buildTransitions() {
        Map<ItemStatus, Set<ItemStatus>> shared = new EnumMap<>(ItemStatus.class);
        shared.put(ItemStatus.TO_BE_REFUNDED, EnumSet.of(
                ItemStatus.REFUND_SENT,
                ItemStatus.TO_BE_QUARANTINED,
                ItemStatus.FEE_ONLY
        ));
        shared.put(ItemStatus.REFUND_SENT, EnumSet.of(
                ItemStatus.REFUNDED,
                ItemStatus.TO_BE_REFUNDED,
                ItemStatus.NEEDS_RECONCILIATION
        ));
        shared.put(ItemStatus.TO_BE_QUARANTINED, EnumSet.of(
                ItemStatus.QUARANTINE_SENT,
                ItemStatus.QUARANTINE_FAILED,
                ItemStatus.FEE_ONLY
        ));
        shared.put(ItemStatus.QUARANTINE_SENT, EnumSet.of(
                ItemStatus.QUARANTINED,
                ItemStatus.TO_BE_QUARANTINED,
                ItemStatus.NEEDS_RECONCILIATION
        ));
        // operator requeue
        shared.put(ItemStatus.QUARANTINE_FAILED, EnumSet.of(ItemStatus.TO_BE_QUARANTINED));

        Map<ItemStatus, Set<ItemStatus>> deposit = new EnumMap<>(shared);
        deposit.put(ItemStatus.DETECTED, EnumSet.of(
                ItemStatus.READY_FOR_PROCESSING,
                ItemStatus.TO_BE_REFUNDED,
                ItemStatus.FEE_ONLY
        ));
        deposit.put(ItemStatus.READY_FOR_PROCESSING, EnumSet.of(
                ItemStatus.AWAITING_CONFIRMATION,
                ItemStatus.TO_BE_REFUNDED
        ));
        deposit.put(ItemStatus.AWAITING_CONFIRMATION, EnumSet.of(
                ItemStatus.PROCESSED,
                ItemStatus.READY_FOR_PROCESSING,
                ItemStatus.NEEDS_RECONCILIATION
        ));

        Map<ItemStatus, Set<ItemStatus>> credit = new EnumMap<>(shared);
        credit.put(ItemStatus.PENDING_MAPPING, EnumSet.of(
                ItemStatus.READY_FOR_PROCESSING,
                ItemStatus.TO_BE_REFUNDED,
                ItemStatus.FEE_ONLY
        ));
        credit.put(ItemStatus.READY_FOR_PROCESSING, EnumSet.of(
                ItemStatus.SENDING,
                ItemStatus.TO_BE_REFUNDED
        ));
        credit.put(ItemStatus.SENDING, EnumSet.of(
                ItemStatus.AWAITING_CONFIRMATION,
                ItemStatus.TO_BE_REFUNDED
        ));
        credit.put(ItemStatus.AWAITING_CONFIRMATION, EnumSet.of(
                ItemStatus.PROCESSED,
                ItemStatus.READY_FOR_PROCESSING,
                ItemStatus.NEEDS_RECONCILIATION
        ));

        Map<ItemKind, Map<ItemStatus, Set<ItemStatus>>> out = new EnumMap<>(ItemKind.class);
        out.put(ItemKind.DEPOSIT, deposit);
        out.put(ItemKind.CREDIT, credit);
        return out;
    }

    public static boolean isTransitionAllowed(ItemKind kind, ItemStatus from, ItemStatus to) {
        if (kind == null || from == null || to == null || from == to) {
            return false;
        }
        return allowedTransitions(kind, from).contains(to);
    }

    /**
     * @throws IllegalStateException if {@code from -> to} is not a legal move for {@code kind}
     */
    public static void validateTransition(ItemKind kind, ItemStatus from, ItemStatus to) {
        if (!isTransitionAllowed(kind, from, to)) {
            throw new IllegalStateException(
                    "Invalid %s status transition: %s -> %s. Allowed from %s: %s"
                            .formatted(kind, from, to, from, allowedTransitions(kind, from))
            );
        }
    }

    public static Set<ItemStatus> allowedTransitions(ItemKind kind, ItemStatus from) {
        return ALLOWED_TRANSITIONS.getOrDefault(kind, Map.of()).getOrDefault(from, Set.of());
    }
}
