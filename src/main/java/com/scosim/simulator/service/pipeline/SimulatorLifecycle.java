package com.scosim.simulator.service.pipeline;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts every pipeline stage on its own daemon thread and owns the shared stop signal and counters.
 */
public class SimulatorLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(SimulatorLifecycle.class);

    private final List<PipelineStage> stages;
    private final StopSignal stopSignal;
    private final SimulatorStats stats;
    private final Duration gracePeriod;

    private final List<Thread> threads = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SimulatorLifecycle(List<PipelineStage> stages, StopSignal stopSignal, SimulatorStats stats,
                              Duration gracePeriod) {
        this.stages = List.copyOf(stages);
        this.stopSignal = stopSignal;
        this.stats = stats;
        this.gracePeriod = gracePeriod;
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Simulator already started");
        }
        for (PipelineStage stage : stages) {
            Thread thread = new Thread(stage, stage.getName());
            thread.setDaemon(true);
            threads.add(thread);
            thread.start();
        }
        logger.info("Started {} pipeline stages: {}", stages.size(), stages.stream().map(PipelineStage::getName).toList());
    }

    /**
     * Block until the stop signal trips.
     */
    public void awaitStop() throws InterruptedException {
        while (!stopSignal.await(1, TimeUnit.SECONDS)) {
            // keep waiting
        }
        logger.info("Stop requested: {}", stopSignal.getReason());
    }

    /**
     * Trip the stop signal and give in-flight work a fixed grace period. Safe to call more than once.
     */
    @PreDestroy
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        stopSignal.trip("shutdown requested");
        if (started.get()) {
            try {
                Thread.sleep(gracePeriod.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            for (Thread thread : threads) {
                if (thread.isAlive()) {
                    logger.warn("Stage {} still running after grace period", thread.getName());
                }
            }
        }
        logger.info("Simulator stopped. Counters: {}", stats.snapshot());
    }

    public StopSignal getStopSignal() {
        return stopSignal;
    }

    public SimulatorStats getStats() {
        return stats;
    }
}
