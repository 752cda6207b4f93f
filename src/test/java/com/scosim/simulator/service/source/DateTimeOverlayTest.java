package com.scosim.simulator.service.source;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeOverlayTest {

    @Test
    void testFormat_UsesConfiguredZone() {
        assertEquals("2023-11-14 22:13:20", new DateTimeOverlay(ZoneOffset.UTC).format(1700000000000L));
        assertEquals("2023-11-15 05:13:20", new DateTimeOverlay(ZoneId.of("Asia/Bangkok")).format(1700000000000L));
    }
}
