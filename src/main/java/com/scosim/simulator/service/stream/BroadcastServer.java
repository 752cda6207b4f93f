package com.scosim.simulator.service.stream;

import com.scosim.simulator.service.pipeline.PipelineStage;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Warms up the encoder, starts the media server, and keeps it running until the simulator stops.
 * A server that fails to start stops the simulator.
 */
public class BroadcastServer extends PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastServer.class);

    private final EncoderWarmup warmup;
    private final MediaServerEngine engine;

    public BroadcastServer(EncoderWarmup warmup, MediaServerEngine engine, StopSignal stopSignal, SimulatorStats stats) {
        super("BroadcastServer", stopSignal, stats);
        this.warmup = warmup;
        this.engine = engine;
    }

    @Override
    protected void onStart() throws Exception {
        warmup.run();
        engine.start();
        logger.info("Ready at {}", engine.endpointUrl());
    }

    @Override
    protected void runOnce() throws InterruptedException {
        stopSignal.await(1, TimeUnit.SECONDS);
    }

    @Override
    protected void onStop() {
        engine.stop();
    }
}
