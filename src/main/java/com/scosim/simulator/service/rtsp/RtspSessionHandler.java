package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.service.stream.FrameSink;
import com.scosim.simulator.service.stream.FrameSinkFactory;
import com.scosim.simulator.service.stream.MediaSessionListener;
import com.scosim.simulator.service.stream.PushResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.rtsp.RtspHeaderNames;
import io.netty.handler.codec.rtsp.RtspMethods;
import io.netty.handler.codec.rtsp.RtspResponseStatuses;
import io.netty.handler.codec.rtsp.RtspVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RTSP control connection for one client. Supports UDP unicast only.
 * Each playing session is paced by its own single-thread ticker, so a slow encode only delays that session.
 * Sessions set up on this connection are torn down when it closes.
 */
class RtspSessionHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(RtspSessionHandler.class);

    static final String PUBLIC_METHODS = "OPTIONS, DESCRIBE, SETUP, PLAY, GET_PARAMETER, TEARDOWN";
    static final int SESSION_TIMEOUT_SECONDS = 60;

    private static final Pattern CLIENT_PORT = Pattern.compile("client_port=(\\d+)(?:-(\\d+))?");

    private final String mountPath;
    private final int fps;
    private final MediaSessionListener listener;
    private final FrameSinkFactory sinkFactory;
    private final Supplier<ScheduledExecutorService> tickerFactory;
    private final IntSupplier serverPortAllocator;

    private final Map<String, RtspMediaSession> sessions = new LinkedHashMap<>();

    RtspSessionHandler(String mountPath, int fps, MediaSessionListener listener, FrameSinkFactory sinkFactory,
                       Supplier<ScheduledExecutorService> tickerFactory, IntSupplier serverPortAllocator) {
        this.mountPath = mountPath;
        this.fps = fps;
        this.listener = listener;
        this.sinkFactory = sinkFactory;
        this.tickerFactory = tickerFactory;
        this.serverPortAllocator = serverPortAllocator;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.info("New client connected from IP: {}", hostOf(ctx.channel().remoteAddress()));
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String cseq = req.headers().get(RtspHeaderNames.CSEQ);
        if (!req.decoderResult().isSuccess()) {
            respond(ctx, cseq, RtspResponseStatuses.BAD_REQUEST);
            return;
        }
        HttpMethod method = req.method();
        if (!RtspMethods.OPTIONS.equals(method) && !isMountPath(req.uri())) {
            respond(ctx, cseq, RtspResponseStatuses.NOT_FOUND);
            return;
        }

        if (RtspMethods.OPTIONS.equals(method)) {
            FullHttpResponse response = response(cseq, RtspResponseStatuses.OK);
            response.headers().set(RtspHeaderNames.PUBLIC, PUBLIC_METHODS);
            ctx.writeAndFlush(response);
        } else if (RtspMethods.DESCRIBE.equals(method)) {
            describe(ctx, req, cseq);
        } else if (RtspMethods.SETUP.equals(method)) {
            setup(ctx, req, cseq);
        } else if (RtspMethods.PLAY.equals(method)) {
            play(ctx, req, cseq);
        } else if (RtspMethods.GET_PARAMETER.equals(method)) {
            keepAlive(ctx, req, cseq);
        } else if (RtspMethods.TEARDOWN.equals(method)) {
            teardown(ctx, req, cseq);
        } else {
            FullHttpResponse response = response(cseq, RtspResponseStatuses.METHOD_NOT_ALLOWED);
            response.headers().set(RtspHeaderNames.ALLOW, PUBLIC_METHODS);
            ctx.writeAndFlush(response);
        }
    }

    private void describe(ChannelHandlerContext ctx, FullHttpRequest req, String cseq) {
        String sdp = sdp(hostOf(ctx.channel().localAddress()));
        byte[] body = sdp.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = response(cseq, RtspResponseStatuses.OK, Unpooled.wrappedBuffer(body));
        response.headers().set(RtspHeaderNames.CONTENT_TYPE, "application/sdp");
        response.headers().set(RtspHeaderNames.CONTENT_BASE, req.uri().endsWith("/") ? req.uri() : req.uri() + "/");
        ctx.writeAndFlush(response);
    }

    String sdp(String host) {
        return "v=0\r\n"
                + "o=- " + System.currentTimeMillis() + " 1 IN IP4 " + host + "\r\n"
                + "s=SCO Simulator\r\n"
                + "c=IN IP4 0.0.0.0\r\n"
                + "t=0 0\r\n"
                + "a=control:*\r\n"
                + "m=video 0 RTP/AVP 96\r\n"
                + "a=rtpmap:96 H264/90000\r\n"
                + "a=fmtp:96 packetization-mode=1\r\n"
                + "a=framerate:" + fps + "\r\n"
                + "a=control:trackID=0\r\n";
    }

    private void setup(ChannelHandlerContext ctx, FullHttpRequest req, String cseq) {
        String transport = req.headers().get(RtspHeaderNames.TRANSPORT);
        if (transport == null || transport.contains("RTP/AVP/TCP") || transport.contains("interleaved")) {
            respond(ctx, cseq, RtspResponseStatuses.UNSUPPORTED_TRANSPORT);
            return;
        }
        Matcher matcher = CLIENT_PORT.matcher(transport);
        if (!matcher.find()) {
            respond(ctx, cseq, RtspResponseStatuses.UNSUPPORTED_TRANSPORT);
            return;
        }
        int rtpPort = Integer.parseInt(matcher.group(1));
        int rtcpPort = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : rtpPort + 1;

        SocketAddress remote = ctx.channel().remoteAddress();
        InetAddress clientAddress = remote instanceof InetSocketAddress inet
                ? inet.getAddress()
                : InetAddress.getLoopbackAddress();
        int serverPort = serverPortAllocator.getAsInt();
        String sessionId = listener.onConfigure(hostOf(remote));
        sessions.put(sessionId, new RtspMediaSession(sessionId, new InetSocketAddress(clientAddress, rtpPort), serverPort));

        FullHttpResponse response = response(cseq, RtspResponseStatuses.OK);
        response.headers().set(RtspHeaderNames.TRANSPORT, "RTP/AVP;unicast;client_port=" + rtpPort + "-" + rtcpPort
                + ";server_port=" + serverPort + "-" + (serverPort + 1));
        response.headers().set(RtspHeaderNames.SESSION, sessionId + ";timeout=" + SESSION_TIMEOUT_SECONDS);
        ctx.writeAndFlush(response);
    }

    private void play(ChannelHandlerContext ctx, FullHttpRequest req, String cseq) {
        RtspMediaSession session = sessions.get(sessionIdOf(req));
        if (session == null) {
            respond(ctx, cseq, RtspResponseStatuses.SESSION_NOT_FOUND);
            return;
        }
        if (!session.isPlaying()) {
            FrameSink sink;
            try {
                sink = sinkFactory.openRtp(session.getClientRtp(), session.getServerRtpPort());
            } catch (Exception e) {
                logger.error("Cannot open encoder for client {}: {}", session.getId(), e.getMessage());
                respond(ctx, cseq, RtspResponseStatuses.INTERNAL_SERVER_ERROR);
                return;
            }
            long periodMicros = 1_000_000L / fps;
            ScheduledExecutorService ticker = tickerFactory.get();
            ticker.scheduleAtFixedRate(() -> tick(ctx, session), 0, periodMicros, TimeUnit.MICROSECONDS);
            if (!session.play(sink, ticker)) {
                respond(ctx, cseq, RtspResponseStatuses.SESSION_NOT_FOUND);
                return;
            }
        }
        FullHttpResponse response = response(cseq, RtspResponseStatuses.OK);
        response.headers().set(RtspHeaderNames.SESSION, session.getId());
        response.headers().set(RtspHeaderNames.RANGE, "npt=0.000-");
        ctx.writeAndFlush(response);
    }

    void tick(ChannelHandlerContext ctx, RtspMediaSession session) {
        FrameSink sink = session.currentSink();
        if (sink == null) {
            return;
        }
        try {
            if (listener.onNeedData(session.getId(), sink) == PushResult.UNKNOWN_SESSION) {
                logger.info("Session {} no longer tracked, closing stream", session.getId());
                ctx.executor().execute(() -> closeSession(session.getId()));
            }
        } catch (RuntimeException e) {
            logger.error("Error pushing frame to {}: {}", session.getId(), e.getMessage());
        }
    }

    private void keepAlive(ChannelHandlerContext ctx, FullHttpRequest req, String cseq) {
        FullHttpResponse response = response(cseq, RtspResponseStatuses.OK);
        String sessionId = sessionIdOf(req);
        if (sessionId != null) {
            response.headers().set(RtspHeaderNames.SESSION, sessionId);
        }
        ctx.writeAndFlush(response);
    }

    private void teardown(ChannelHandlerContext ctx, FullHttpRequest req, String cseq) {
        String sessionId = sessionIdOf(req);
        if (sessionId == null || !sessions.containsKey(sessionId)) {
            respond(ctx, cseq, RtspResponseStatuses.SESSION_NOT_FOUND);
            return;
        }
        closeSession(sessionId);
        FullHttpResponse response = response(cseq, RtspResponseStatuses.OK);
        response.headers().set(RtspHeaderNames.SESSION, sessionId);
        ctx.writeAndFlush(response);
    }

    private void closeSession(String sessionId) {
        RtspMediaSession session = sessions.remove(sessionId);
        if (session != null && session.close()) {
            listener.onUnprepared(sessionId);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        for (String sessionId : sessions.keySet().toArray(new String[0])) {
            closeSession(sessionId);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("RTSP connection error: {}", cause.getMessage());
        ctx.close();
    }

    int sessionCount() {
        return sessions.size();
    }

    boolean isMountPath(String uri) {
        String path;
        try {
            path = uri.startsWith("rtsp://") ? URI.create(uri).getPath() : uri;
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (path == null) {
            return false;
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.equals(mountPath) || path.startsWith(mountPath + "/");
    }

    private static String sessionIdOf(FullHttpRequest req) {
        String value = req.headers().get(RtspHeaderNames.SESSION);
        if (value == null) {
            return null;
        }
        int semicolon = value.indexOf(';');
        return (semicolon >= 0 ? value.substring(0, semicolon) : value).trim();
    }

    private static String hostOf(SocketAddress address) {
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return address == null ? "0.0.0.0" : address.toString();
    }

    private static void respond(ChannelHandlerContext ctx, String cseq, HttpResponseStatus status) {
        ctx.writeAndFlush(response(cseq, status));
    }

    private static FullHttpResponse response(String cseq, HttpResponseStatus status) {
        return response(cseq, status, Unpooled.EMPTY_BUFFER);
    }

    private static FullHttpResponse response(String cseq, HttpResponseStatus status, ByteBuf body) {
        FullHttpResponse response = new DefaultFullHttpResponse(RtspVersions.RTSP_1_0, status, body);
        if (cseq != null) {
            response.headers().set(RtspHeaderNames.CSEQ, cseq);
        }
        response.headers().setInt(RtspHeaderNames.CONTENT_LENGTH, body.readableBytes());
        return response;
    }
}
