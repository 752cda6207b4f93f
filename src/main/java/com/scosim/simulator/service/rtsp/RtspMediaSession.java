package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.service.stream.FrameSink;
import lombok.Getter;

import java.net.InetSocketAddress;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Transport state of one SETUP on a connection: where to send RTP and the running encoder, if playing.
 */
@Getter
class RtspMediaSession {

    private final String id;
    private final InetSocketAddress clientRtp;
    private final int serverRtpPort;

    private FrameSink sink;
    private ScheduledExecutorService ticker;
    private boolean closed;

    RtspMediaSession(String id, InetSocketAddress clientRtp, int serverRtpPort) {
        this.id = id;
        this.clientRtp = clientRtp;
        this.serverRtpPort = serverRtpPort;
    }

    synchronized boolean isPlaying() {
        return ticker != null && !closed;
    }

    /**
     * @return false if the session was closed in the meantime
     */
    synchronized boolean play(FrameSink sink, ScheduledExecutorService ticker) {
        if (closed) {
            ticker.shutdown();
            sink.close();
            return false;
        }
        this.sink = sink;
        this.ticker = ticker;
        return true;
    }

    synchronized FrameSink currentSink() {
        return closed ? null : sink;
    }

    /**
     * @return true if this call closed the session
     */
    synchronized boolean close() {
        if (closed) {
            return false;
        }
        closed = true;
        if (ticker != null) {
            ticker.shutdown();
        }
        if (sink != null) {
            sink.close();
        }
        return true;
    }
}
