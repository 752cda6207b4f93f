package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;

/**
 * Draws on a captured image before it is cropped.
 */
@FunctionalInterface
public interface FrameOverlay {

    FrameOverlay NONE = (image, timestampMillis) -> image;

    BgrImage apply(BgrImage image, long timestampMillis);
}
