package io.ledgerbridge.storage;

import io.ledgerbridge.model.ItemKind;

/**
 * Held reservation. Closing releases it; closing twice is a no-op.
 */
public final class ReservationLease implements AutoCloseable {
    private final ReservationStore store;
    private final ItemKind kind;
    private final String key;
    private final String holder;
    private final long expiresAtMs;
    private boolean released;

    ReservationLease(ReservationStore store, ItemKind kind, String key, String holder, long expiresAtMs) {
        this.store = store;
        this.kind = kind;
        this.key = key;
        this.holder = holder;
        this.expiresAtMs = expiresAtMs;
    }

    public ItemKind kind() {
        return kind;
    }

    public String key() {
        return key;
    }

    public String holder() {
        return holder;
    }

    public long expiresAtMs() {
        return expiresAtMs;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        store.release(kind, key, holder);
    }
}
