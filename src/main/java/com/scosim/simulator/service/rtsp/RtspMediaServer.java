package com.scosim.simulator.service.rtsp;

import com.scosim.simulator.service.stream.FrameSinkFactory;
import com.scosim.simulator.service.stream.MediaServerEngine;
import com.scosim.simulator.service.stream.MediaSessionListener;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.rtsp.RtspDecoder;
import io.netty.handler.codec.rtsp.RtspEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RTSP server on one port and mount path. Every playing session gets its own encoder and its own ticker thread
 * paced at {@code fps}, and pulls frames through the {@link MediaSessionListener}.
 */
public class RtspMediaServer implements MediaServerEngine {

    private static final Logger logger = LoggerFactory.getLogger(RtspMediaServer.class);

    private static final int MAX_CONTENT_LENGTH = 64 * 1024;
    private static final int FIRST_SERVER_PORT = 20000;
    private static final int SERVER_PORT_RANGE = 10000;

    private final int port;
    private final String mountPath;
    private final int fps;
    private final MediaSessionListener listener;
    private final FrameSinkFactory sinkFactory;
    private final AtomicInteger nextServerPort = new AtomicInteger();
    private final ThreadFactory pushThreads = daemonThreads("rtsp-push");

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public RtspMediaServer(int port, String mountPath, int fps, MediaSessionListener listener,
                           FrameSinkFactory sinkFactory) {
        this.port = port;
        this.mountPath = mountPath;
        this.fps = fps;
        this.listener = listener;
        this.sinkFactory = sinkFactory;
    }

    @Override
    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new RtspDecoder());
                            ch.pipeline().addLast(new RtspEncoder());
                            ch.pipeline().addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            ch.pipeline().addLast(new RtspSessionHandler(mountPath, fps, listener, sinkFactory,
                                    RtspMediaServer.this::newTicker, RtspMediaServer.this::allocateServerPort));
                        }
                    });
            serverChannel = bootstrap.bind(port).sync().channel();
            logger.info("RTSP server started on port {}", port);
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    @Override
    public synchronized void stop() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        logger.info("RTSP server stopped");
    }

    @Override
    public String endpointUrl() {
        return "rtsp://0.0.0.0:" + port + mountPath;
    }

    private ScheduledExecutorService newTicker() {
        return Executors.newSingleThreadScheduledExecutor(pushThreads);
    }

    /**
     * Even RTP port for the next session; RTCP uses the following odd port.
     */
    int allocateServerPort() {
        int slot = Math.floorMod(nextServerPort.getAndIncrement(), SERVER_PORT_RANGE / 2);
        return FIRST_SERVER_PORT + slot * 2;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
