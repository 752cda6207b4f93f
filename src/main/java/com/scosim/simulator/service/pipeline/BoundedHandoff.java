package com.scosim.simulator.service.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity queue between two pipeline stages.
 *
 * <p>An offer waits at most {@code offerTimeout} for space and then gives up with
 * {@link OfferOutcome#DROPPED}; the queue never grows and the producer never blocks indefinitely.</p>
 */
public class BoundedHandoff<T> {

    public enum OfferOutcome {
        ACCEPTED,
        DROPPED
    }

    private final String name;
    private final BlockingQueue<T> queue;
    private final int capacity;
    private final long offerTimeoutMillis;

    public BoundedHandoff(String name, int capacity, Duration offerTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeoutMillis = Math.max(0L, offerTimeout.toMillis());
    }

    public OfferOutcome offer(T item) {
        Objects.requireNonNull(item, "item");
        try {
            if (queue.offer(item, offerTimeoutMillis, TimeUnit.MILLISECONDS)) {
                return OfferOutcome.ACCEPTED;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return OfferOutcome.DROPPED;
    }

    /**
     * @return the head of the queue, or null if nothing arrived within the timeout
     */
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public String getName() {
        return name;
    }
}
