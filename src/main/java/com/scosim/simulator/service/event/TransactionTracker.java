package com.scosim.simulator.service.event;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the single active transaction id.
 */
public class TransactionTracker {

    private final Supplier<String> idSupplier;
    private final AtomicReference<String> current;

    public TransactionTracker() {
        this(() -> UUID.randomUUID().toString());
    }

    public TransactionTracker(Supplier<String> idSupplier) {
        this.idSupplier = idSupplier;
        this.current = new AtomicReference<>(idSupplier.get());
    }

    public String current() {
        return current.get();
    }

    /**
     * Mint a new id and make it the active one.
     *
     * @return the new id
     */
    public String rotate() {
        String next = idSupplier.get();
        current.set(next);
        return next;
    }
}
