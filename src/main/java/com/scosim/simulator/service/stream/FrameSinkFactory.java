package com.scosim.simulator.service.stream;

import java.net.InetSocketAddress;

public interface FrameSinkFactory {

    /**
     * Encoder that sends RTP to one client.
     */
    FrameSink openRtp(InetSocketAddress target, int localRtpPort) throws Exception;

    /**
     * Encoder whose output is thrown away. Used to warm up the codec.
     */
    FrameSink openDiscarding() throws Exception;
}
