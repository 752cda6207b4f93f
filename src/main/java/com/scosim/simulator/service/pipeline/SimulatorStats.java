package com.scosim.simulator.service.pipeline;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters shared by the pipeline stages. Owned by the lifecycle and handed to each stage.
 */
public class SimulatorStats {

    public enum Counter {
        FRAMES_READ,
        FRAMES_DROPPED,
        CODES_DECODED,
        EVENTS_DROPPED,
        MALFORMED_PAYLOADS,
        UNKNOWN_KINDS,
        EVENTS_SENT,
        DISPATCH_TIMEOUTS,
        DISPATCH_ERRORS,
        FRAMES_STREAMED,
        DECODER_RESTARTS,
        ERRORS
    }

    private final Map<Counter, LongAdder> counters = new EnumMap<>(Counter.class);

    public SimulatorStats() {
        for (Counter counter : Counter.values()) {
            counters.put(counter, new LongAdder());
        }
    }

    public void increment(Counter counter) {
        counters.get(counter).increment();
    }

    public long get(Counter counter) {
        return counters.get(counter).sum();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        for (Map.Entry<Counter, LongAdder> e : counters.entrySet()) {
            values.put(e.getKey().name().toLowerCase(), e.getValue().sum());
        }
        return values;
    }
}
