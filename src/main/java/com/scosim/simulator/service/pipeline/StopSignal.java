package com.scosim.simulator.service.pipeline;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by every pipeline stage.
 * Stages poll it at each timeout-bounded wait; nothing is interrupted.
 */
public class StopSignal {

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    private volatile String reason;
    private volatile boolean failure;

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Request an orderly stop.
     *
     * @return true if this call tripped the signal, false if it was already tripped
     */
    public boolean trip(String reason) {
        return trip(reason, false);
    }

    /**
     * Request a stop because a stage failed. The process exits non-zero afterwards.
     */
    public boolean tripOnFailure(String reason) {
        return trip(reason, true);
    }

    private boolean trip(String reason, boolean failure) {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason;
        this.failure = failure;
        latch.countDown();
        return true;
    }

    /**
     * Wait up to the given timeout for the signal to trip.
     *
     * @return true if stopped
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    public String getReason() {
        return reason;
    }

    public boolean isFailure() {
        return failure;
    }
}
