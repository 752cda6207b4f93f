package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.concurrent.TimeUnit;

/**
 * Reads a local clip through FFmpeg in real time, resampled to a fixed output rate.
 *
 * <p>Frames are released on a wall-clock schedule of {@code fps}. Source frames are skipped or repeated
 * so the emitted sequence follows the clip's own timeline. When the clip ends it is rewound and playback
 * continues from its first frame.</p>
 */
public class FFmpegRawFrameReader implements RawFrameReader {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegRawFrameReader.class);

    private final FFmpegFrameGrabber grabber;
    private final MediaResourceCleaner cleaner;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private final int width;
    private final int height;
    private final long frameIntervalMicros;
    private final long frameIntervalNanos;
    private final long startNanos;

    private long emitted;
    private BgrImage last;
    private long lastTimestampMicros;
    private long loopOffsetMicros;

    FFmpegRawFrameReader(FFmpegFrameGrabber grabber, MediaResourceCleaner cleaner, int width, int height, int fps) {
        this.grabber = grabber;
        this.cleaner = cleaner;
        this.width = width;
        this.height = height;
        this.frameIntervalMicros = 1_000_000L / fps;
        this.frameIntervalNanos = 1_000_000_000L / fps;
        this.startNanos = System.nanoTime();
    }

    @Override
    public BgrImage read() throws FrameReadException, InterruptedException {
        pace();
        long targetMicros = emitted * frameIntervalMicros;
        boolean rewound = false;
        try {
            while (last == null || loopOffsetMicros + lastTimestampMicros < targetMicros) {
                Frame frame = grabber.grabImage();
                if (frame == null) {
                    if (last == null || rewound) {
                        return null;
                    }
                    // next pass starts one frame after the end of this one
                    loopOffsetMicros += lastTimestampMicros + frameIntervalMicros;
                    lastTimestampMicros = -frameIntervalMicros;
                    grabber.setTimestamp(0L);
                    rewound = true;
                    logger.debug("End of clip, rewinding (offset {}us)", loopOffsetMicros);
                    continue;
                }
                last = toImage(frame);
                lastTimestampMicros = Math.max(0L, frame.timestamp);
                rewound = false;
            }
        } catch (FrameGrabber.Exception e) {
            throw new FrameReadException("Decode failed: " + e.getMessage(), e);
        }
        emitted++;
        return last;
    }

    private void pace() throws InterruptedException {
        long due = startNanos + emitted * frameIntervalNanos;
        long wait = due - System.nanoTime();
        if (wait > 0) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }

    private BgrImage toImage(Frame frame) throws FrameReadException {
        if (frame.image == null || frame.imageChannels != 3
                || frame.imageWidth != width || frame.imageHeight != height) {
            throw new FrameReadException(String.format("Unexpected frame %dx%dx%d, wanted %dx%dx3",
                    frame.imageWidth, frame.imageHeight, frame.imageChannels, width, height));
        }
        BufferedImage image = converter.convert(frame);
        if (image == null) {
            throw new FrameReadException("Frame could not be converted");
        }
        // converter reuses its image, fromBufferedImage copies
        return BgrImage.fromBufferedImage(image);
    }

    @Override
    public void close() {
        cleaner.closeGrabber(grabber);
        converter.close();
    }
}
