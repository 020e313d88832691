package io.ledgerbridge.ledger;

public class LedgerException extends RuntimeException {

    public enum Kind {
        /** Nothing happened; safe to retry. */
        TRANSIENT,
        /** The ledger refused the request. */
        REJECTED,
        /** The request may or may not have landed. */
        AMBIGUOUS
    }

    private final Kind kind;

    public LedgerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LedgerException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean ambiguous() {
        return kind == Kind.AMBIGUOUS;
    }
}
