package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.model.FramePair;
import com.scosim.simulator.service.pipeline.BoundedHandoff;
import com.scosim.simulator.service.pipeline.PipelineStage;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.SimulatorStats.Counter;
import com.scosim.simulator.service.pipeline.StopSignal;
import com.scosim.simulator.util.FpsMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Decodes the clip, stamps each capture with the wall-clock time, and hands frame pairs to the code extractor.
 *
 * <p>Decoder faults and end of stream are recovered here by reopening the reader. A full decode queue drops
 * the frame.</p>
 */
public class FrameSource extends PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(FrameSource.class);

    private final RawFrameReaderFactory readerFactory;
    private final FrameOverlay overlay;
    private final FrameCropper cropper;
    private final BoundedHandoff<FramePair> decodeQueue;
    private final Clock clock;
    private final Duration restartBackoff;
    private final FpsMeter grabFps;

    private RawFrameReader reader;

    public FrameSource(RawFrameReaderFactory readerFactory, FrameOverlay overlay, FrameCropper cropper,
                       BoundedHandoff<FramePair> decodeQueue, Clock clock, Duration restartBackoff,
                       int fpsLogInterval, StopSignal stopSignal, SimulatorStats stats) {
        super("FrameSource", stopSignal, stats);
        this.readerFactory = readerFactory;
        this.overlay = overlay;
        this.cropper = cropper;
        this.decodeQueue = decodeQueue;
        this.clock = clock;
        this.restartBackoff = restartBackoff;
        this.grabFps = new FpsMeter("GRAB FPS", fpsLogInterval);
    }

    @Override
    protected void runOnce() throws InterruptedException {
        BgrImage capture;
        try {
            if (reader == null) {
                reader = readerFactory.open();
            }
            capture = reader.read();
            if (capture == null) {
                restart("End of stream");
                return;
            }
        } catch (FrameReadException e) {
            restart(e.getMessage());
            return;
        }

        long timestamp = clock.millis();
        FramePair pair = cropper.split(overlay.apply(capture, timestamp), timestamp);
        if (decodeQueue.offer(pair) == BoundedHandoff.OfferOutcome.ACCEPTED) {
            stats.increment(Counter.FRAMES_READ);
            grabFps.tick();
        } else {
            stats.increment(Counter.FRAMES_DROPPED);
            logger.warn("Decode queue full, dropping frame");
        }
    }

    private void restart(String reason) throws InterruptedException {
        logger.warn("{}, restarting decoder...", reason);
        stats.increment(Counter.DECODER_RESTARTS);
        closeReader();
        stopSignal.await(restartBackoff.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void closeReader() {
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    @Override
    protected void onStop() {
        closeReader();
    }
}
