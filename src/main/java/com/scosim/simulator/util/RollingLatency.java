package com.scosim.simulator.util;

/**
 * Min / avg / max of latency samples since the last reset. Not thread-safe; owned by one stage.
 */
public class RollingLatency {

    private double min = Double.MAX_VALUE;
    private double max;
    private double sum;
    private int samples;

    public void record(double millis) {
        min = Math.min(min, millis);
        max = Math.max(max, millis);
        sum += millis;
        samples++;
    }

    public double min() {
        return samples == 0 ? 0.0 : min;
    }

    public double max() {
        return max;
    }

    public double avg() {
        return samples == 0 ? 0.0 : sum / samples;
    }

    public int samples() {
        return samples;
    }

    public void reset() {
        min = Double.MAX_VALUE;
        max = 0;
        sum = 0;
        samples = 0;
    }

    @Override
    public String toString() {
        return String.format("%.1f/%.1f/%.1fms", avg(), min(), max());
    }
}
