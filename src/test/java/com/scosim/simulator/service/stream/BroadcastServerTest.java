package com.scosim.simulator.service.stream;

import com.scosim.simulator.service.pipeline.LiveFrameSlot;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.StopSignal;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastServerTest {

    private static class FakeEngine implements MediaServerEngine {
        final AtomicBoolean started = new AtomicBoolean();
        final AtomicBoolean stopped = new AtomicBoolean();
        Exception startFailure;

        @Override
        public void start() throws Exception {
            if (startFailure != null) {
                throw startFailure;
            }
            started.set(true);
        }

        @Override
        public void stop() {
            stopped.set(true);
        }

        @Override
        public String endpointUrl() {
            return "rtsp://0.0.0.0:8554/simulation";
        }
    }

    private static EncoderWarmup noWarmup() {
        FrameSinkFactory unused = new FrameSinkFactory() {
            @Override
            public FrameSink openRtp(InetSocketAddress target, int localRtpPort) {
                throw new UnsupportedOperationException();
            }

            @Override
            public FrameSink openDiscarding() {
                throw new UnsupportedOperationException();
            }
        };
        return new EncoderWarmup(new LiveFrameSlot(), unused, 0, 8, 8, 15);
    }

    @Test
    void testEngineRunsUntilStopSignal() throws Exception {
        StopSignal signal = new StopSignal();
        FakeEngine engine = new FakeEngine();
        BroadcastServer server = new BroadcastServer(noWarmup(), engine, signal, new SimulatorStats());
        Thread thread = new Thread(server);
        thread.start();

        long deadline = System.currentTimeMillis() + 5000;
        while (!engine.started.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(engine.started.get());
        assertFalse(engine.stopped.get());

        signal.trip("test done");
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(thread.isAlive());
        assertTrue(engine.stopped.get());
    }

    @Test
    void testEngineStartFailureStopsSimulator() {
        StopSignal signal = new StopSignal();
        FakeEngine engine = new FakeEngine();
        engine.startFailure = new java.net.BindException("Address already in use");

        new BroadcastServer(noWarmup(), engine, signal, new SimulatorStats()).run();

        assertTrue(signal.isStopped());
        assertTrue(signal.isFailure());
    }
}
