package com.scosim.simulator.service.stream;

import com.scosim.simulator.model.VideoFrame;
import com.scosim.simulator.service.pipeline.LiveFrameSlot;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.SimulatorStats.Counter;
import com.scosim.simulator.util.FpsMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the live frame to every client. Each tick reads the current slot value, so all clients share
 * the same live edge and none of them can hold up the producer.
 */
public class LiveStreamBroadcaster implements MediaSessionListener {

    private static final Logger logger = LoggerFactory.getLogger(LiveStreamBroadcaster.class);

    private final LiveFrameSlot liveFrameSlot;
    private final ClientSessionRegistry registry;
    private final long frameDurationMicros;
    private final SimulatorStats stats;
    private final FpsMeter encodeFps;

    public LiveStreamBroadcaster(LiveFrameSlot liveFrameSlot, ClientSessionRegistry registry, int fps,
                                 int fpsLogInterval, SimulatorStats stats) {
        this.liveFrameSlot = liveFrameSlot;
        this.registry = registry;
        this.frameDurationMicros = 1_000_000L / fps;
        this.stats = stats;
        this.encodeFps = new FpsMeter("ENCODE FPS", fpsLogInterval);
    }

    @Override
    public String onConfigure(String remoteAddress) {
        ClientSession session = registry.open(remoteAddress);
        logger.info("Client {} from {} configured (total connections: {})",
                session.getId(), remoteAddress, registry.size());
        return session.getId();
    }

    @Override
    public PushResult onNeedData(String sessionId, FrameSink sink) {
        ClientSession session = registry.get(sessionId);
        if (session == null) {
            return PushResult.UNKNOWN_SESSION;
        }
        VideoFrame frame = liveFrameSlot.current();
        if (frame == null) {
            return PushResult.NO_DATA;
        }
        try {
            long pts = session.advance(frame.getTimestamp(), frameDurationMicros);
            PushResult result = sink.push(frame.getImage(), pts);
            if (result == PushResult.OK) {
                stats.increment(Counter.FRAMES_STREAMED);
                encodeFps.tick();
            } else if (result != PushResult.FLUSHING) {
                logger.warn("Push buffer failed for client {}: {}", sessionId, result);
            }
            return result;
        } catch (Exception e) {
            logger.error("Error in need-data for client {}: {}", sessionId, e.getMessage());
            stats.increment(Counter.ERRORS);
            return PushResult.ERROR;
        }
    }

    @Override
    public void onUnprepared(String sessionId) {
        if (registry.close(sessionId) != null) {
            logger.info("Client {} disconnected, state cleaned up (remaining connections: {})",
                    sessionId, registry.size());
        }
    }

    public ClientSessionRegistry getRegistry() {
        return registry;
    }
}
