package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.service.source.MediaResourceCleaner;
import com.scosim.simulator.service.stream.FrameSink;
import com.scosim.simulator.service.stream.FrameSinkFactory;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;

import java.io.OutputStream;
import java.net.InetSocketAddress;

/**
 * Low-latency H.264 encoders built with JavaCV.
 */
public class FFmpegFrameSinkFactory implements FrameSinkFactory {

    private static final int VIDEO_BITRATE = 2_000_000;

    private final int width;
    private final int height;
    private final int fps;
    private final MediaResourceCleaner cleaner;

    public FFmpegFrameSinkFactory(int width, int height, int fps, MediaResourceCleaner cleaner) {
        this.width = width;
        this.height = height;
        this.fps = fps;
        this.cleaner = cleaner;
    }

    @Override
    public FrameSink openRtp(InetSocketAddress target, int localRtpPort) throws FFmpegFrameRecorder.Exception {
        String url = String.format("rtp://%s:%d?localrtpport=%d&localrtcpport=%d",
                target.getAddress().getHostAddress(), target.getPort(), localRtpPort, localRtpPort + 1);
        FFmpegFrameRecorder recorder = new FFmpegFrameRecorder(url, width, height, 0);
        recorder.setFormat("rtp");
        return start(recorder);
    }

    @Override
    public FrameSink openDiscarding() throws FFmpegFrameRecorder.Exception {
        FFmpegFrameRecorder recorder = new FFmpegFrameRecorder(OutputStream.nullOutputStream(), width, height);
        recorder.setFormat("h264");
        return start(recorder);
    }

    private FrameSink start(FFmpegFrameRecorder recorder) throws FFmpegFrameRecorder.Exception {
        configureRecorder(recorder);
        try {
            recorder.start();
        } catch (FFmpegFrameRecorder.Exception e) {
            cleaner.closeRecorder(recorder);
            throw e;
        }
        return new FFmpegFrameSink(recorder, cleaner, width, height);
    }

    private void configureRecorder(FFmpegFrameRecorder recorder) {
        recorder.setVideoCodec(avcodec.AV_CODEC_ID_H264);
        recorder.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);
        recorder.setVideoBitrate(VIDEO_BITRATE);

        // timing & keyframes
        recorder.setFrameRate(fps);
        recorder.setGopSize(fps * 2);
        recorder.setOption("x264-params", "repeat-headers=1");

        // latency
        recorder.setOption("preset", "ultrafast");
        recorder.setOption("tune", "zerolatency");
        recorder.setOption("bf", "0");
    }
}
