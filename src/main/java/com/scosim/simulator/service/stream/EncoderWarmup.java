package com.scosim.simulator.service.stream;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.model.VideoFrame;
import com.scosim.simulator.service.pipeline.LiveFrameSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes frames through a throwaway encoder before clients connect. Failures are logged and ignored.
 */
public class EncoderWarmup {

    private static final Logger logger = LoggerFactory.getLogger(EncoderWarmup.class);

    private static final long PUSH_DELAY_MILLIS = 10;

    private final LiveFrameSlot liveFrameSlot;
    private final FrameSinkFactory sinkFactory;
    private final int frames;
    private final int width;
    private final int height;
    private final long frameDurationMicros;
    private final long pushDelayMillis;

    public EncoderWarmup(LiveFrameSlot liveFrameSlot, FrameSinkFactory sinkFactory, int frames,
                         int width, int height, int fps) {
        this(liveFrameSlot, sinkFactory, frames, width, height, fps, PUSH_DELAY_MILLIS);
    }

    EncoderWarmup(LiveFrameSlot liveFrameSlot, FrameSinkFactory sinkFactory, int frames,
                  int width, int height, int fps, long pushDelayMillis) {
        this.liveFrameSlot = liveFrameSlot;
        this.sinkFactory = sinkFactory;
        this.frames = frames;
        this.width = width;
        this.height = height;
        this.frameDurationMicros = 1_000_000L / fps;
        this.pushDelayMillis = pushDelayMillis;
    }

    /**
     * @return number of frames the encoder accepted
     */
    public int run() throws InterruptedException {
        if (frames <= 0) {
            logger.info("Encoder warmup disabled");
            return 0;
        }
        logger.info("Starting encoder warmup ({} frames)...", frames);
        int pushed = 0;
        BgrImage blank = null;
        try (FrameSink sink = sinkFactory.openDiscarding()) {
            for (int i = 0; i < frames; i++) {
                VideoFrame latest = liveFrameSlot.current();
                BgrImage image;
                if (latest != null) {
                    image = latest.getImage();
                } else {
                    if (blank == null) {
                        blank = BgrImage.blank(width, height);
                    }
                    image = blank;
                }
                if (sink.push(image, i * frameDurationMicros) != PushResult.OK) {
                    break;
                }
                pushed++;
                Thread.sleep(pushDelayMillis);
            }
            logger.info("Encoder warmup completed ({} frames)", pushed);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("Warmup failed (non-critical): {}", e.getMessage());
        }
        return pushed;
    }
}
