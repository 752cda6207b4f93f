package com.scosim.simulator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Primary and code views cropped from one captured image. Both share that image's timestamp.
 */
@Getter
@RequiredArgsConstructor
public class FramePair {
    private final BgrImage primary;
    private final BgrImage code;
    private final long timestamp;

    public VideoFrame primaryFrame() {
        return new VideoFrame(primary, timestamp);
    }
}
