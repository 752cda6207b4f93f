package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;

/**
 * Stream of raw BGR frames at the original capture resolution, delivered at the target rate.
 */
public interface RawFrameReader extends AutoCloseable {

    /**
     * Block until the next frame is due.
     *
     * @return the next frame, or null at end of stream
     */
    BgrImage read() throws FrameReadException, InterruptedException;

    @Override
    void close();
}
