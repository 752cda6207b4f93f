package com.scosim.simulator.service.source;

/**
 * The decoder failed to produce a frame. Always recovered locally by restarting the reader.
 */
public class FrameReadException extends Exception {

    public FrameReadException(String message) {
        super(message);
    }

    public FrameReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
