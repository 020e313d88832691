package io.ledgerbridge.ledger;

import java.util.Optional;

/**
 * Memo attached to every engine transfer: {@code <action>:<itemId>}. It is the lookup key
 * for ambiguous submissions and for rebuilding state from the chains.
 */
public record TransferMemo(Action action, String itemId) {

    public enum Action {
        PAYOUT("payout"),
        REFUND("refund"),
        QUARANTINE("quarantine");

        private final String prefix;

        Action(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public TransferMemo {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
    }

    public static String payout(String itemId) {
        return new TransferMemo(Action.PAYOUT, itemId).encode();
    }

    public static String refund(String itemId) {
        return new TransferMemo(Action.REFUND, itemId).encode();
    }

    public static String quarantine(String itemId) {
        return new TransferMemo(Action.QUARANTINE, itemId).encode();
    }

    public String encode() {
        return action.prefix() + ":" + itemId;
    }

    public static Optional<TransferMemo> parse(String memo) {
        if (memo == null) {
            return Optional.empty();
        }
        String trimmed = memo.trim();
        int idx = trimmed.indexOf(':');
        if (idx <= 0 || idx == trimmed.length() - 1) {
            return Optional.empty();
        }
        String prefix = trimmed.substring(0, idx);
        String itemId = trimmed.substring(idx + 1).trim();
        if (itemId.isEmpty()) {
            return Optional.empty();
        }
        for (Action action : Action.values()) {
            if (action.prefix().equals(prefix)) {
                return Optional.of(new TransferMemo(action, itemId));
            }
        }
        return Optional.empty();
    }
}
