package com.scosim.simulator.service.stream;

/**
 * Callbacks the media server invokes for each client. The server keeps only the returned session id.
 */
public interface MediaSessionListener {

    /**
     * A client set up a stream.
     *
     * @return opaque session id
     */
    String onConfigure(String remoteAddress);

    /**
     * The client's encoder is ready for its next frame.
     */
    PushResult onNeedData(String sessionId, FrameSink sink);

    /**
     * The client is gone.
     */
    void onUnprepared(String sessionId);
}
