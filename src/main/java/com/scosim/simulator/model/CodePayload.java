package com.scosim.simulator.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Text decoded from a code view, with the timestamp of the frame it was read from.
 * {@code structured} is set only when the text parsed as JSON.
 */
@Getter
@RequiredArgsConstructor
public class CodePayload {
    private final String raw;
    private final JsonNode structured;
    private final long timestamp;

    public boolean isStructured() {
        return structured != null;
    }
}
