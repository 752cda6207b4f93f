package com.scosim.simulator.service.stream;

/**
 * Outcome of handing one frame to a client's encoder.
 */
public enum PushResult {
    OK,
    /** Nothing published yet. */
    NO_DATA,
    /** The client is going away; normal on disconnect. */
    FLUSHING,
    ERROR,
    UNKNOWN_SESSION
}
