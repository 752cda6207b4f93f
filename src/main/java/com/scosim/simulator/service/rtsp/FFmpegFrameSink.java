package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.service.source.MediaResourceCleaner;
import com.scosim.simulator.service.stream.FrameSink;
import com.scosim.simulator.service.stream.PushResult;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds BGR images into a started {@link FFmpegFrameRecorder}.
 */
class FFmpegFrameSink implements FrameSink {

    private static final Logger logger = LoggerFactory.getLogger(FFmpegFrameSink.class);

    private final FFmpegFrameRecorder recorder;
    private final MediaResourceCleaner cleaner;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private final int width;
    private final int height;

    private long lastTimestampMicros = -1;
    private boolean closed;

    FFmpegFrameSink(FFmpegFrameRecorder recorder, MediaResourceCleaner cleaner, int width, int height) {
        this.recorder = recorder;
        this.cleaner = cleaner;
        this.width = width;
        this.height = height;
    }

    @Override
    public synchronized PushResult push(BgrImage image, long timestampMicros) {
        if (closed) {
            return PushResult.FLUSHING;
        }
        if (image.getWidth() != width || image.getHeight() != height) {
            logger.warn("Frame {}x{} does not match encoder {}x{}", image.getWidth(), image.getHeight(), width, height);
            return PushResult.ERROR;
        }
        Frame frame = converter.convert(image.toBufferedImage());
        try {
            if (timestampMicros > lastTimestampMicros) {
                recorder.setTimestamp(timestampMicros);
                lastTimestampMicros = timestampMicros;
            }
            recorder.record(frame, avutil.AV_PIX_FMT_BGR24);
            return PushResult.OK;
        } catch (FFmpegFrameRecorder.Exception e) {
            logger.debug("Encode failed: {}", e.getMessage());
            return PushResult.ERROR;
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        cleaner.closeRecorder(recorder);
        converter.close();
    }
}
