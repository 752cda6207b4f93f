package com.scosim.simulator.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Long-running pipeline task. Runs {@link #runOnce()} until the shared stop signal trips.
 *
 * <p>Each iteration must return within a bounded time (every blocking wait uses a timeout) so the
 * stop flag is observed promptly. A fault escaping an iteration stops the whole simulator.</p>
 */
public abstract class PipelineStage implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineStage.class);

    private final String name;
    protected final StopSignal stopSignal;
    protected final SimulatorStats stats;

    protected PipelineStage(String name, StopSignal stopSignal, SimulatorStats stats) {
        this.name = Objects.requireNonNull(name, "name");
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    @Override
    public final void run() {
        log.info("[{}] Starting", name);
        try {
            onStart();
            while (!stopSignal.isStopped()) {
                runOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted, stopping simulator", name);
            stopSignal.trip(name + " interrupted");
        } catch (Exception e) {
            log.error("[{}] Error: {}", name, e.getMessage(), e);
            stats.increment(SimulatorStats.Counter.ERRORS);
            stopSignal.tripOnFailure(name + " failed: " + e.getMessage());
        } finally {
            try {
                onStop();
            } catch (Exception e) {
                log.warn("[{}] Error during shutdown: {}", name, e.getMessage());
            }
            log.info("[{}] Stopped", name);
        }
    }

    /** Called once on the stage thread before the loop. */
    protected void onStart() throws Exception {
    }

    /** One bounded unit of work. */
    protected abstract void runOnce() throws Exception;

    /** Called once on the stage thread after the loop, also after a failure. */
    protected void onStop() {
    }

    public String getName() {
        return name;
    }
}
