package com.scosim.simulator.service.qr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.scosim.simulator.model.CodePayload;
import com.scosim.simulator.model.FramePair;
import com.scosim.simulator.service.pipeline.BoundedHandoff;
import com.scosim.simulator.service.pipeline.LiveFrameSlot;
import com.scosim.simulator.service.pipeline.PipelineStage;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.SimulatorStats.Counter;
import com.scosim.simulator.service.pipeline.StopSignal;
import com.scosim.simulator.util.RollingLatency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads the code view of each frame pair, queues decoded payloads for dispatch, and publishes the primary
 * view to the live slot whether or not a code was found.
 */
public class CodeExtractor extends PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(CodeExtractor.class);

    private final BoundedHandoff<FramePair> decodeQueue;
    private final BoundedHandoff<CodePayload> eventQueue;
    private final LiveFrameSlot liveFrameSlot;
    private final CodeReader codeReader;
    private final ObjectReader jsonReader;
    private final Duration pollTimeout;
    private final int statsInterval;

    private final RollingLatency decodeLatency = new RollingLatency();
    private long frameCounter;

    public CodeExtractor(BoundedHandoff<FramePair> decodeQueue, BoundedHandoff<CodePayload> eventQueue,
                         LiveFrameSlot liveFrameSlot, CodeReader codeReader, ObjectMapper objectMapper,
                         Duration pollTimeout, int statsInterval, StopSignal stopSignal, SimulatorStats stats) {
        super("CodeExtractor", stopSignal, stats);
        this.decodeQueue = decodeQueue;
        this.eventQueue = eventQueue;
        this.liveFrameSlot = liveFrameSlot;
        this.codeReader = codeReader;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.pollTimeout = pollTimeout;
        this.statsInterval = Math.max(1, statsInterval);
    }

    @Override
    protected void runOnce() throws InterruptedException {
        FramePair pair = decodeQueue.poll(pollTimeout);
        if (pair == null) {
            if (frameCounter > 0) {
                logger.debug("Decode queue empty, waiting for frames...");
            }
            return;
        }
        long loopStart = System.nanoTime();
        frameCounter++;

        Optional<String> text;
        long decodeStart = System.nanoTime();
        try {
            text = codeReader.decode(pair.getCode());
        } catch (RuntimeException e) {
            logger.debug("QR decode failed: {}", e.getMessage());
            text = Optional.empty();
        }
        decodeLatency.record((System.nanoTime() - decodeStart) / 1_000_000.0);

        text.ifPresent(raw -> enqueue(new CodePayload(raw, parseStructured(raw), pair.getTimestamp())));

        liveFrameSlot.publish(pair.primaryFrame());

        if (frameCounter % statsInterval == 0) {
            double loopMillis = (System.nanoTime() - loopStart) / 1_000_000.0;
            logger.info("Stats: DecodeQueue={}, EventQueue={}, QR_Time(avg/min/max)={}, Loop={}ms",
                    decodeQueue.size(), eventQueue.size(), decodeLatency, String.format("%.1f", loopMillis));
            decodeLatency.reset();
        }
    }

    private void enqueue(CodePayload payload) {
        stats.increment(Counter.CODES_DECODED);
        if (eventQueue.offer(payload) == BoundedHandoff.OfferOutcome.DROPPED) {
            stats.increment(Counter.EVENTS_DROPPED);
            logger.warn("Event queue full, dropping QR data");
        }
    }

    JsonNode parseStructured(String raw) {
        try {
            JsonNode node = jsonReader.readTree(raw);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public long getFrameCounter() {
        return frameCounter;
    }
}
