package com.scosim.simulator.service.stream;

import lombok.Getter;

import java.time.Instant;

/**
 * Per-client playback state. Each session numbers its own frames from zero.
 */
@Getter
public class ClientSession {

    private final String id;
    private final String remoteAddress;
    private final Instant createdAt;

    private long frameCounter;
    private Long lastServedTimestamp;

    public ClientSession(String id, String remoteAddress, Instant createdAt) {
        this.id = id;
        this.remoteAddress = remoteAddress;
        this.createdAt = createdAt;
    }

    /**
     * Record that a frame is being served and move to the next slot.
     *
     * @return presentation time for the served frame
     */
    public synchronized long advance(long servedTimestamp, long frameDurationMicros) {
        lastServedTimestamp = servedTimestamp;
        long pts = frameCounter * frameDurationMicros;
        frameCounter++;
        return pts;
    }

    public synchronized long getFrameCounter() {
        return frameCounter;
    }

    public synchronized Long getLastServedTimestamp() {
        return lastServedTimestamp;
    }
}
