package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.service.stream.FrameSink;
import com.scosim.simulator.service.stream.FrameSinkFactory;
import com.scosim.simulator.service.stream.MediaSessionListener;
import com.scosim.simulator.service.stream.PushResult;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.rtsp.RtspHeaderNames;
import io.netty.handler.codec.rtsp.RtspMethods;
import io.netty.handler.codec.rtsp.RtspVersions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RtspSessionHandlerTest {

    private static final String MOUNT = "/simulation";
    private static final String URL = "rtsp://127.0.0.1:8554/simulation";
    private static final String UDP_TRANSPORT = "RTP/AVP;unicast;client_port=5000-5001";

    private static class FakeListener implements MediaSessionListener {
        final AtomicInteger configured = new AtomicInteger();
        final List<String> unprepared = new ArrayList<>();
        final Map<String, AtomicInteger> ticks = new ConcurrentHashMap<>();
        final CountDownLatch release = new CountDownLatch(1);
        volatile String stalledSession;

        @Override
        public String onConfigure(String remoteAddress) {
            return "session-" + configured.incrementAndGet();
        }

        @Override
        public PushResult onNeedData(String sessionId, FrameSink sink) {
            ticks.computeIfAbsent(sessionId, id -> new AtomicInteger()).incrementAndGet();
            if (sessionId.equals(stalledSession)) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return PushResult.NO_DATA;
        }

        int ticksOf(String sessionId) {
            AtomicInteger count = ticks.get(sessionId);
            return count == null ? 0 : count.get();
        }

        @Override
        public synchronized void onUnprepared(String sessionId) {
            unprepared.add(sessionId);
        }
    }

    private static class FakeSink implements FrameSink {
        volatile boolean closed;

        @Override
        public PushResult push(BgrImage image, long timestampMicros) {
            return PushResult.OK;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static class FakeSinkFactory implements FrameSinkFactory {
        final List<FakeSink> opened = new ArrayList<>();
        InetSocketAddress lastTarget;
        int lastLocalPort;
        boolean fail;

        @Override
        public synchronized FrameSink openRtp(InetSocketAddress target, int localRtpPort) throws Exception {
            if (fail) {
                throw new Exception("encoder unavailable");
            }
            lastTarget = target;
            lastLocalPort = localRtpPort;
            FakeSink sink = new FakeSink();
            opened.add(sink);
            return sink;
        }

        @Override
        public FrameSink openDiscarding() {
            throw new UnsupportedOperationException();
        }
    }

    private FakeListener listener;
    private FakeSinkFactory sinkFactory;
    private List<ScheduledExecutorService> tickers;
    private EmbeddedChannel channel;
    private int cseq;

    @BeforeEach
    void setUp() {
        listener = new FakeListener();
        sinkFactory = new FakeSinkFactory();
        tickers = new CopyOnWriteArrayList<>();
        AtomicInteger ports = new AtomicInteger(20000);
        channel = new EmbeddedChannel(new RtspSessionHandler(MOUNT, 15, listener, sinkFactory, this::newTicker,
                () -> ports.getAndAdd(2)));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
        tickers.forEach(ScheduledExecutorService::shutdownNow);
    }

    private ScheduledExecutorService newTicker() {
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor();
        tickers.add(ticker);
        return ticker;
    }

    private FullHttpResponse send(HttpMethod method, String uri, String... headers) {
        FullHttpRequest request = new DefaultFullHttpRequest(RtspVersions.RTSP_1_0, method, uri);
        request.headers().set(RtspHeaderNames.CSEQ, String.valueOf(++cseq));
        for (int i = 0; i + 1 < headers.length; i += 2) {
            request.headers().set(headers[i], headers[i + 1]);
        }
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response to " + method);
        assertEquals(String.valueOf(cseq), response.headers().get(RtspHeaderNames.CSEQ));
        return response;
    }

    private String setUpSession() {
        FullHttpResponse response = send(RtspMethods.SETUP, URL + "/trackID=0",
                RtspHeaderNames.TRANSPORT.toString(), UDP_TRANSPORT);
        try {
            assertEquals(200, response.status().code());
            String session = response.headers().get(RtspHeaderNames.SESSION);
            return session.substring(0, session.indexOf(';'));
        } finally {
            response.release();
        }
    }

    @Test
    void testOptions_ListsPublicMethods() {
        FullHttpResponse response = send(RtspMethods.OPTIONS, "*");

        assertEquals(200, response.status().code());
        assertEquals(RtspSessionHandler.PUBLIC_METHODS, response.headers().get(RtspHeaderNames.PUBLIC));
        response.release();
    }

    @Test
    void testDescribe_ReturnsH264Sdp() {
        FullHttpResponse response = send(RtspMethods.DESCRIBE, URL);

        assertEquals(200, response.status().code());
        assertEquals("application/sdp", response.headers().get(RtspHeaderNames.CONTENT_TYPE));
        assertEquals(URL + "/", response.headers().get(RtspHeaderNames.CONTENT_BASE));
        String body = response.content().toString(StandardCharsets.UTF_8);
        assertTrue(body.contains("m=video 0 RTP/AVP 96"));
        assertTrue(body.contains("a=rtpmap:96 H264/90000"));
        assertTrue(body.contains("a=framerate:15"));
        assertEquals(body.getBytes(StandardCharsets.UTF_8).length,
                response.headers().getInt(RtspHeaderNames.CONTENT_LENGTH));
        response.release();
    }

    @Test
    void testDescribe_OtherPathIsNotFound() {
        FullHttpResponse response = send(RtspMethods.DESCRIBE, "rtsp://127.0.0.1:8554/other");

        assertEquals(404, response.status().code());
        response.release();
    }

    @Test
    void testSetup_UdpCreatesSession() {
        FullHttpResponse response = send(RtspMethods.SETUP, URL + "/trackID=0",
                RtspHeaderNames.TRANSPORT.toString(), UDP_TRANSPORT);

        assertEquals(200, response.status().code());
        assertEquals("session-1;timeout=60", response.headers().get(RtspHeaderNames.SESSION));
        assertEquals("RTP/AVP;unicast;client_port=5000-5001;server_port=20000-20001",
                response.headers().get(RtspHeaderNames.TRANSPORT));
        assertEquals(1, listener.configured.get());
        response.release();
    }

    @Test
    void testSetup_TcpInterleavedIsUnsupported() {
        FullHttpResponse response = send(RtspMethods.SETUP, URL + "/trackID=0",
                RtspHeaderNames.TRANSPORT.toString(), "RTP/AVP/TCP;unicast;interleaved=0-1");

        assertEquals(461, response.status().code());
        assertEquals(0, listener.configured.get());
        response.release();
    }

    @Test
    void testSetup_MissingClientPortIsUnsupported() {
        FullHttpResponse response = send(RtspMethods.SETUP, URL + "/trackID=0",
                RtspHeaderNames.TRANSPORT.toString(), "RTP/AVP;unicast");

        assertEquals(461, response.status().code());
        response.release();
    }

    @Test
    void testPlay_UnknownSession() {
        FullHttpResponse response = send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), "nope");

        assertEquals(454, response.status().code());
        assertTrue(sinkFactory.opened.isEmpty());
        response.release();
    }

    @Test
    void testPlay_OpensEncoderTowardsClientPort() {
        String session = setUpSession();

        FullHttpResponse response = send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), session);

        assertEquals(200, response.status().code());
        assertEquals(session, response.headers().get(RtspHeaderNames.SESSION));
        assertEquals("npt=0.000-", response.headers().get(RtspHeaderNames.RANGE));
        assertEquals(1, sinkFactory.opened.size());
        assertEquals(5000, sinkFactory.lastTarget.getPort());
        assertEquals(20000, sinkFactory.lastLocalPort);
        response.release();
    }

    @Test
    void testPlay_EachSessionHasItsOwnTicker() {
        String first = setUpSession();
        String second = setUpSession();
        send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), first).release();
        send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), second).release();

        assertEquals(2, tickers.size());

        send(RtspMethods.TEARDOWN, URL, RtspHeaderNames.SESSION.toString(), first).release();

        assertTrue(tickers.get(0).isShutdown());
        assertFalse(tickers.get(1).isShutdown());
    }

    @Test
    void testPlay_StalledSessionDoesNotDelayOthers() throws Exception {
        String slow = setUpSession();
        String fast = setUpSession();
        listener.stalledSession = slow;
        try {
            send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), slow).release();
            send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), fast).release();

            long deadline = System.currentTimeMillis() + 5000;
            while (listener.ticksOf(fast) < 5 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertTrue(listener.ticksOf(fast) >= 5, "fast session ticked " + listener.ticksOf(fast) + " times");
            assertTrue(listener.ticksOf(slow) <= 1);
        } finally {
            listener.release.countDown();
        }
    }

    @Test
    void testPlay_EncoderFailureIsServerError() {
        String session = setUpSession();
        sinkFactory.fail = true;

        FullHttpResponse response = send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), session);

        assertEquals(500, response.status().code());
        response.release();
    }

    @Test
    void testTeardown_ClosesSinkAndNotifiesListener() {
        String session = setUpSession();
        send(RtspMethods.PLAY, URL, RtspHeaderNames.SESSION.toString(), session).release();

        FullHttpResponse response = send(RtspMethods.TEARDOWN, URL, RtspHeaderNames.SESSION.toString(), session);

        assertEquals(200, response.status().code());
        assertTrue(sinkFactory.opened.get(0).closed);
        assertEquals(List.of(session), listener.unprepared);
        response.release();

        FullHttpResponse again = send(RtspMethods.TEARDOWN, URL, RtspHeaderNames.SESSION.toString(), session);
        assertEquals(454, again.status().code());
        assertEquals(1, listener.unprepared.size());
        again.release();
    }

    @Test
    void testConnectionClose_TearsDownSessions() {
        String first = setUpSession();
        String second = setUpSession();

        channel.close();

        assertEquals(List.of(first, second), listener.unprepared);
    }

    @Test
    void testGetParameter_KeepAlive() {
        String session = setUpSession();

        FullHttpResponse response = send(RtspMethods.GET_PARAMETER, URL, RtspHeaderNames.SESSION.toString(), session);

        assertEquals(200, response.status().code());
        assertEquals(session, response.headers().get(RtspHeaderNames.SESSION));
        response.release();
    }

    @Test
    void testUnsupportedMethod() {
        FullHttpResponse response = send(RtspMethods.RECORD, URL);

        assertEquals(405, response.status().code());
        assertEquals(RtspSessionHandler.PUBLIC_METHODS, response.headers().get(RtspHeaderNames.ALLOW));
        response.release();
    }

    @Test
    void testIsMountPath() {
        RtspSessionHandler handler = new RtspSessionHandler(MOUNT, 15, listener, sinkFactory, this::newTicker, () -> 0);

        assertTrue(handler.isMountPath(URL));
        assertTrue(handler.isMountPath(URL + "/"));
        assertTrue(handler.isMountPath(URL + "/trackID=0"));
        assertTrue(handler.isMountPath("/simulation"));
        assertFalse(handler.isMountPath("rtsp://127.0.0.1:8554/simulationx"));
        assertFalse(handler.isMountPath("rtsp://127.0.0.1:8554/"));
    }
}
