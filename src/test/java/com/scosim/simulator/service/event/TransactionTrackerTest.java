package com.scosim.simulator.service.event;

import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTrackerTest {

    @Test
    void testInitialIdIsAUuid() {
        TransactionTracker tracker = new TransactionTracker();

        assertDoesNotThrow(() -> UUID.fromString(tracker.current()));
    }

    @Test
    void testRotate_ReplacesActiveId() {
        Iterator<String> ids = List.of("a", "b", "c").iterator();
        TransactionTracker tracker = new TransactionTracker(ids::next);

        assertEquals("a", tracker.current());
        assertEquals("b", tracker.rotate());
        assertEquals("b", tracker.current());
        assertEquals("b", tracker.current());
        assertEquals("c", tracker.rotate());
    }
}
