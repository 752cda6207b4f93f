package com.scosim.simulator.service.source;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FrameGrabber;
import org.springframework.stereotype.Component;

/**
 * Configures an FFmpeg grabber for reading a local clip as packed BGR frames.
 */
@Component
public class FFmpegGrabberConfig {

    /**
     * Configure the grabber and start it.
     *
     * @param grabber grabber opened on the clip
     * @param width   output width, frames are scaled to it
     * @param height  output height
     * @throws FrameGrabber.Exception if the clip cannot be opened
     */
    public void configureGrabber(FFmpegFrameGrabber grabber, int width, int height) throws FrameGrabber.Exception {
        grabber.setImageMode(FrameGrabber.ImageMode.COLOR);
        grabber.setPixelFormat(avutil.AV_PIX_FMT_BGR24);
        grabber.setImageWidth(width);
        grabber.setImageHeight(height);

        // Decoder threads
        grabber.setOption("threads", "1");

        // Error tolerance
        grabber.setOption("err_detect", "ignore_err");
        grabber.setOption("ec", "favor_inter+guess_mvs+deblock");
        grabber.setOption("fflags", "+discardcorrupt+genpts");
        grabber.setOption("allowed_media_types", "video");

        grabber.start();
    }
}
