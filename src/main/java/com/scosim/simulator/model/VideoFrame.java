package com.scosim.simulator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * An image plus the simulated playback timestamp (epoch millis) it was captured at.
 */
@Getter
@RequiredArgsConstructor
public class VideoFrame {
    private final BgrImage image;
    private final long timestamp;
}
