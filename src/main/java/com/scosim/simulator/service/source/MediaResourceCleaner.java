package com.scosim.simulator.service.source;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stops and releases FFmpeg grabbers and recorders. Never throws; failures are logged.
 */
@Component
public class MediaResourceCleaner {

    private static final Logger logger = LoggerFactory.getLogger(MediaResourceCleaner.class);

    public void closeGrabber(FFmpegFrameGrabber grabber) {
        if (grabber == null) {
            return;
        }
        try {
            grabber.stop();
            logger.debug("Grabber stopped successfully");
        } catch (Exception e) {
            logger.warn("Error stopping grabber: {}", e.getMessage());
        }
        try {
            grabber.release();
            logger.debug("Grabber released successfully");
        } catch (Exception e) {
            logger.error("Error releasing grabber: {}", e.getMessage(), e);
        }
    }

    public void closeRecorder(FFmpegFrameRecorder recorder) {
        if (recorder == null) {
            return;
        }
        try {
            recorder.stop();
            logger.debug("Recorder stopped successfully");
        } catch (Exception e) {
            logger.warn("Error stopping recorder: {}", e.getMessage());
        }
        try {
            recorder.release();
            logger.debug("Recorder released successfully");
        } catch (Exception e) {
            logger.error("Error releasing recorder: {}", e.getMessage(), e);
        }
    }
}
