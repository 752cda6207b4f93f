package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.model.FramePair;

/**
 * Splits a capture into the primary view (top-left, output size) and the code view
 * (square in the bottom-right corner of the original capture).
 */
public class FrameCropper {

    private final int originalWidth;
    private final int originalHeight;
    private final int frameWidth;
    private final int frameHeight;
    private final int codeSize;

    public FrameCropper(int originalWidth, int originalHeight, int frameWidth, int frameHeight, int codeSize) {
        if (frameWidth > originalWidth || frameHeight > originalHeight) {
            throw new IllegalArgumentException("Output " + frameWidth + "x" + frameHeight
                    + " larger than capture " + originalWidth + "x" + originalHeight);
        }
        if (codeSize <= 0 || codeSize > Math.min(originalWidth, originalHeight)) {
            throw new IllegalArgumentException("Invalid code region size " + codeSize);
        }
        if (frameWidth > originalWidth - codeSize && frameHeight > originalHeight - codeSize) {
            throw new IllegalArgumentException("Primary region overlaps the code region");
        }
        this.originalWidth = originalWidth;
        this.originalHeight = originalHeight;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.codeSize = codeSize;
    }

    public FramePair split(BgrImage capture, long timestamp) {
        if (capture.getWidth() != originalWidth || capture.getHeight() != originalHeight) {
            throw new IllegalArgumentException("Capture is " + capture.getWidth() + "x" + capture.getHeight()
                    + ", expected " + originalWidth + "x" + originalHeight);
        }
        BgrImage primary = capture.crop(0, 0, frameWidth, frameHeight);
        BgrImage code = capture.crop(originalWidth - codeSize, originalHeight - codeSize, codeSize, codeSize);
        return new FramePair(primary, code, timestamp);
    }
}
