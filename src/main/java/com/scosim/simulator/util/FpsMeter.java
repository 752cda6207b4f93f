package com.scosim.simulator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts ticks and logs the observed rate every {@code interval} ticks.
 */
public class FpsMeter {

    private static final Logger logger = LoggerFactory.getLogger(FpsMeter.class);

    private final String label;
    private final int interval;

    private int count;
    private long windowStartNanos = System.nanoTime();

    public FpsMeter(String label, int interval) {
        this.label = label;
        this.interval = Math.max(1, interval);
    }

    public synchronized void tick() {
        count++;
        if (count >= interval) {
            double elapsed = (System.nanoTime() - windowStartNanos) / 1_000_000_000.0;
            double fps = elapsed > 0 ? count / elapsed : 0.0;
            logger.info("[{}] {} fps ({} frames in {}s)", label,
                    String.format("%.2f", fps), count, String.format("%.2f", elapsed));
            count = 0;
            windowStartNanos = System.nanoTime();
        }
    }
}
