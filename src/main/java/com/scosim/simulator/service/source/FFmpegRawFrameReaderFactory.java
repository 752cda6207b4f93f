package com.scosim.simulator.service.source;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a fresh FFmpeg reader on the configured clip for every (re)start of the frame source.
 */
public class FFmpegRawFrameReaderFactory implements RawFrameReaderFactory {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegRawFrameReaderFactory.class);

    private final String videoPath;
    private final int width;
    private final int height;
    private final int fps;
    private final FFmpegGrabberConfig grabberConfig;
    private final MediaResourceCleaner cleaner;

    public FFmpegRawFrameReaderFactory(String videoPath, int width, int height, int fps,
                                       FFmpegGrabberConfig grabberConfig, MediaResourceCleaner cleaner) {
        this.videoPath = videoPath;
        this.width = width;
        this.height = height;
        this.fps = fps;
        this.grabberConfig = grabberConfig;
        this.cleaner = cleaner;
    }

    @Override
    public RawFrameReader open() throws FrameReadException {
        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(videoPath);
        try {
            grabberConfig.configureGrabber(grabber, width, height);
        } catch (Exception e) {
            cleaner.closeGrabber(grabber);
            throw new FrameReadException("Cannot open " + videoPath + ": " + e.getMessage(), e);
        }
        logger.info("Opened {} ({}x{} @ {} fps)", videoPath, width, height, fps);
        return new FFmpegRawFrameReader(grabber, cleaner, width, height, fps);
    }
}
