package com.scosim.simulator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The four pipe-separated fields of a code payload: timestamp, global frame index, scan frame index, kind code.
 */
@Getter
@RequiredArgsConstructor
public class EventRecord {
    private final String simulatedTimestamp;
    private final String frameIndex;
    private final String scanFrameIndex;
    private final int kindCode;
}
