package com.scosim.simulator.service.event;

public enum DispatchOutcome {
    SENT,
    TIMEOUT,
    TRANSPORT_ERROR,
    REJECTED
}
