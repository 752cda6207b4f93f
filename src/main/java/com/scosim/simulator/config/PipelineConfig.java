package com.scosim.simulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scosim.simulator.model.CodePayload;
import com.scosim.simulator.model.FramePair;
import com.scosim.simulator.service.asset.VideoAssetResolver;
import com.scosim.simulator.service.event.CameraDeviceDirectory;
import com.scosim.simulator.service.event.EventApiClient;
import com.scosim.simulator.service.event.EventBodyFactory;
import com.scosim.simulator.service.event.EventDispatcher;
import com.scosim.simulator.service.event.TransactionTracker;
import com.scosim.simulator.service.pipeline.BoundedHandoff;
import com.scosim.simulator.service.pipeline.LiveFrameSlot;
import com.scosim.simulator.service.pipeline.SimulatorLifecycle;
import com.scosim.simulator.service.pipeline.SimulatorStats;
import com.scosim.simulator.service.pipeline.StopSignal;
import com.scosim.simulator.service.qr.CodeExtractor;
import com.scosim.simulator.service.qr.ZxingQrCodeReader;
import com.scosim.simulator.service.rtsp.FFmpegFrameSinkFactory;
import com.scosim.simulator.service.rtsp.RtspMediaServer;
import com.scosim.simulator.service.source.DateTimeOverlay;
import com.scosim.simulator.service.source.FFmpegGrabberConfig;
import com.scosim.simulator.service.source.FFmpegRawFrameReaderFactory;
import com.scosim.simulator.service.source.FrameCropper;
import com.scosim.simulator.service.source.FrameOverlay;
import com.scosim.simulator.service.source.FrameSource;
import com.scosim.simulator.service.source.MediaResourceCleaner;
import com.scosim.simulator.service.source.RawFrameReaderFactory;
import com.scosim.simulator.service.stream.BroadcastServer;
import com.scosim.simulator.service.stream.ClientSessionRegistry;
import com.scosim.simulator.service.stream.EncoderWarmup;
import com.scosim.simulator.service.stream.FrameSinkFactory;
import com.scosim.simulator.service.stream.LiveStreamBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Builds the pipeline for the selected camera.
 */
@Configuration
@EnableConfigurationProperties(SimulatorProperties.class)
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

    @Bean
    public CameraSettings cameraSettings(SimulatorProperties properties) {
        CameraSettings settings = CameraSettings.resolve(properties);
        logger.info("Simulating camera {}: video={}, api={}, port={}, fps={}", settings.getCameraName(),
                settings.getVideoPath(), settings.getApiUrl(), settings.getRtspPort(), settings.getFps());
        return settings;
    }

    @Bean
    public CameraDeviceDirectory cameraDeviceDirectory(SimulatorProperties properties) {
        return new CameraDeviceDirectory(properties.getDevices());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StopSignal stopSignal() {
        return new StopSignal();
    }

    @Bean
    public SimulatorStats simulatorStats() {
        return new SimulatorStats();
    }

    @Bean
    public LiveFrameSlot liveFrameSlot() {
        return new LiveFrameSlot();
    }

    @Bean
    public BoundedHandoff<FramePair> decodeQueue(CameraSettings settings) {
        return new BoundedHandoff<>("decode", settings.getQueueSize(), settings.getOfferTimeout());
    }

    @Bean
    public BoundedHandoff<CodePayload> eventQueue(CameraSettings settings) {
        return new BoundedHandoff<>("event", settings.getEventQueueSize(), settings.getEventOfferTimeout());
    }

    @Bean
    public RestTemplate eventRestTemplate(RestTemplateBuilder builder, CameraSettings settings) {
        return builder
                .setConnectTimeout(settings.getRequestTimeout())
                .setReadTimeout(settings.getRequestTimeout())
                .build();
    }

    @Bean
    public VideoAssetResolver videoAssetResolver(RestTemplateBuilder builder) {
        return new VideoAssetResolver(builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(DOWNLOAD_TIMEOUT)
                .build());
    }

    @Bean
    public RawFrameReaderFactory rawFrameReaderFactory(CameraSettings settings, VideoAssetResolver assets,
                                                       FFmpegGrabberConfig grabberConfig, MediaResourceCleaner cleaner) {
        Path video = assets.ensureAvailable(settings.getVideoPath(), settings.getDownloadUrl());
        return new FFmpegRawFrameReaderFactory(video.toString(), settings.getOriginalWidth(),
                settings.getOriginalHeight(), settings.getFps(), grabberConfig, cleaner);
    }

    @Bean
    public FrameSource frameSource(CameraSettings settings, RawFrameReaderFactory readerFactory,
                                   BoundedHandoff<FramePair> decodeQueue, Clock clock,
                                   StopSignal stopSignal, SimulatorStats stats) {
        FrameOverlay overlay = settings.isOverlayEnabled() ? new DateTimeOverlay(settings.getZone()) : FrameOverlay.NONE;
        FrameCropper cropper = new FrameCropper(settings.getOriginalWidth(), settings.getOriginalHeight(),
                settings.getFrameWidth(), settings.getFrameHeight(), settings.getQrcodeSize());
        return new FrameSource(readerFactory, overlay, cropper, decodeQueue, clock, settings.getRestartBackoff(),
                settings.getFpsLogInterval(), stopSignal, stats);
    }

    @Bean
    public CodeExtractor codeExtractor(CameraSettings settings, BoundedHandoff<FramePair> decodeQueue,
                                       BoundedHandoff<CodePayload> eventQueue, LiveFrameSlot liveFrameSlot,
                                       ObjectMapper objectMapper, StopSignal stopSignal, SimulatorStats stats) {
        return new CodeExtractor(decodeQueue, eventQueue, liveFrameSlot, new ZxingQrCodeReader(), objectMapper,
                settings.getPollTimeout(), settings.getStatsInterval(), stopSignal, stats);
    }

    @Bean
    public EventDispatcher eventDispatcher(CameraSettings settings, BoundedHandoff<CodePayload> eventQueue,
                                           RestTemplate eventRestTemplate, CameraDeviceDirectory devices,
                                           StopSignal stopSignal, SimulatorStats stats) {
        String deviceId = devices.resolve(settings.getCameraName());
        logger.info("Events for {} go to {}/events/{}", settings.getCameraName(), settings.getApiUrl(), deviceId);
        EventApiClient client = new EventApiClient(eventRestTemplate, settings.getApiUrl(), deviceId);
        return new EventDispatcher(eventQueue, new EventBodyFactory(new TransactionTracker()), client,
                settings.getPollTimeout(), stopSignal, stats);
    }

    @Bean
    public FrameSinkFactory frameSinkFactory(CameraSettings settings, MediaResourceCleaner cleaner) {
        return new FFmpegFrameSinkFactory(settings.getFrameWidth(), settings.getFrameHeight(), settings.getFps(), cleaner);
    }

    @Bean
    public LiveStreamBroadcaster liveStreamBroadcaster(CameraSettings settings, LiveFrameSlot liveFrameSlot,
                                                       Clock clock, SimulatorStats stats) {
        return new LiveStreamBroadcaster(liveFrameSlot, new ClientSessionRegistry(settings.getMaxSessions(), clock),
                settings.getFps(), settings.getFpsLogInterval(), stats);
    }

    @Bean
    public BroadcastServer broadcastServer(CameraSettings settings, LiveFrameSlot liveFrameSlot,
                                           LiveStreamBroadcaster broadcaster, FrameSinkFactory sinkFactory,
                                           StopSignal stopSignal, SimulatorStats stats) {
        EncoderWarmup warmup = new EncoderWarmup(liveFrameSlot, sinkFactory, settings.getWarmupFrames(),
                settings.getFrameWidth(), settings.getFrameHeight(), settings.getFps());
        RtspMediaServer server = new RtspMediaServer(settings.getRtspPort(), settings.getMountPath(),
                settings.getFps(), broadcaster, sinkFactory);
        return new BroadcastServer(warmup, server, stopSignal, stats);
    }

    @Bean
    public SimulatorLifecycle simulatorLifecycle(CameraSettings settings, FrameSource frameSource,
                                                 CodeExtractor codeExtractor, EventDispatcher eventDispatcher,
                                                 BroadcastServer broadcastServer, StopSignal stopSignal,
                                                 SimulatorStats stats) {
        return new SimulatorLifecycle(List.of(frameSource, codeExtractor, eventDispatcher, broadcastServer),
                stopSignal, stats, settings.getGracePeriod());
    }
}
