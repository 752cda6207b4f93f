package com.scosim.simulator.service.stream;

import com.scosim.simulator.model.BgrImage;

/**
 * Encoder input for one client: accepts one fixed-size BGR image per tick.
 */
public interface FrameSink extends AutoCloseable {

    /**
     * @param image             frame at output resolution
     * @param timestampMicros   presentation time on the client's own timeline
     */
    PushResult push(BgrImage image, long timestampMicros);

    @Override
    void close();
}
