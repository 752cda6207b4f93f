package com.scosim.simulator.service.pipeline;

import com.scosim.simulator.model.VideoFrame;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the most recent primary frame for the broadcaster.
 * One writer (the code extractor), many readers (the per-client stream callbacks).
 * Frames are immutable once published, so a reader sees either the old or the new frame.
 */
public class LiveFrameSlot {

    private final AtomicReference<VideoFrame> current = new AtomicReference<>();

    public void publish(VideoFrame frame) {
        current.set(frame);
    }

    /**
     * @return the latest frame, or null if nothing was published yet
     */
    public VideoFrame current() {
        return current.get();
    }
}
