package com.scosim.simulator.service.event;

import com.scosim.simulator.model.CodePayload;
import com.scosim.simulator.model.EventKind;
import com.scosim.simulator.model.EventRecord;
import com.scosim.simulator.model.dto.EventBody;
import com.scosim.simulator.service.pipeline.BoundedHandoff;
import com.scosim.simulator.service.pipeline.PipelineStage;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.SimulatorStats.Counter;
import com.scosim.simulator.service.pipeline.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns decoded payloads into API calls, one best-effort POST per event.
 * Malformed payloads and unknown kind codes are counted and skipped.
 */
public class EventDispatcher extends PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final BoundedHandoff<CodePayload> eventQueue;
    private final EventBodyFactory bodyFactory;
    private final EventApiClient apiClient;
    private final Duration pollTimeout;

    public EventDispatcher(BoundedHandoff<CodePayload> eventQueue, EventBodyFactory bodyFactory,
                           EventApiClient apiClient, Duration pollTimeout,
                           StopSignal stopSignal, SimulatorStats stats) {
        super("EventDispatcher", stopSignal, stats);
        this.eventQueue = eventQueue;
        this.bodyFactory = bodyFactory;
        this.apiClient = apiClient;
        this.pollTimeout = pollTimeout;
    }

    @Override
    protected void runOnce() throws InterruptedException {
        CodePayload payload = eventQueue.poll(pollTimeout);
        if (payload != null) {
            dispatch(payload);
        }
    }

    void dispatch(CodePayload payload) {
        Optional<EventRecord> record = EventRecordParser.parse(payload.getRaw());
        if (record.isEmpty()) {
            stats.increment(Counter.MALFORMED_PAYLOADS);
            logger.debug("Ignoring malformed payload: {}", payload.getRaw());
            return;
        }
        Optional<EventKind> kind = EventKind.fromCode(record.get().getKindCode());
        if (kind.isEmpty()) {
            stats.increment(Counter.UNKNOWN_KINDS);
            logger.debug("Ignoring unknown event code {}", record.get().getKindCode());
            return;
        }

        EventBody body = bodyFactory.create(kind.get(), payload.getTimestamp());
        switch (apiClient.post(kind.get(), body)) {
            case SENT -> stats.increment(Counter.EVENTS_SENT);
            case TIMEOUT -> stats.increment(Counter.DISPATCH_TIMEOUTS);
            case TRANSPORT_ERROR, REJECTED -> stats.increment(Counter.DISPATCH_ERRORS);
        }
    }
}
