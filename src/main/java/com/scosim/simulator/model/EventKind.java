package com.scosim.simulator.model;

import lombok.Getter;

import java.util.Optional;

/**
 * The eight event kinds a code can carry, keyed by their numeric wire code.
 */
@Getter
public enum EventKind {
    WEIGHING_MISMATCH(0, "weighting-scale-not-matched"),
    STATE_CHANGE(1, "states"),
    ITEM_REMOVED(2, "item-removed"),
    ITEM_ADDED(3, "item-added"),
    TRANSACTION_COMPLETED(4, "transaction-completed"),
    TRANSACTION_STARTED(5, "transaction-started"),
    SCAN_STARTED(6, "scan-started"),
    SCAN_COMPLETED(7, "scan-completed");

    private static final EventKind[] BY_CODE = new EventKind[values().length];

    static {
        for (EventKind kind : values()) {
            BY_CODE[kind.code] = kind;
        }
    }

    private final int code;
    private final String pathSegment;

    EventKind(int code, String pathSegment) {
        this.code = code;
        this.pathSegment = pathSegment;
    }

    public static Optional<EventKind> fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }

    /**
     * @return the API path for this kind, e.g. {@code /events/SCO123/item-added}
     */
    public String path(String deviceId) {
        return "/events/" + deviceId + "/" + pathSegment;
    }
}
