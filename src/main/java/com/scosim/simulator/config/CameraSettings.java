package com.scosim.simulator.config;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Effective settings for the selected camera, checked once at startup.
 */
@Getter
@Builder
public class CameraSettings {

    private static final Logger logger = LoggerFactory.getLogger(CameraSettings.class);

    private final String cameraName;
    private final String videoPath;
    private final String downloadUrl;
    private final String apiUrl;
    private final int rtspPort;
    private final int fps;
    private final int originalWidth;
    private final int originalHeight;
    private final int frameWidth;
    private final int frameHeight;
    private final int qrcodeSize;
    private final int queueSize;
    private final int eventQueueSize;
    private final int warmupFrames;
    private final ZoneId zone;
    private final String mountPath;
    private final Duration requestTimeout;
    private final Duration gracePeriod;
    private final Duration pollTimeout;
    private final Duration offerTimeout;
    private final Duration eventOfferTimeout;
    private final Duration restartBackoff;
    private final int statsInterval;
    private final int fpsLogInterval;
    private final int maxSessions;
    private final boolean overlayEnabled;

    /**
     * @throws IllegalStateException if the selected camera is missing or the geometry is inconsistent
     */
    public static CameraSettings resolve(SimulatorProperties props) {
        SimulatorProperties.CameraProperties camera = props.getCameras().get(props.getCamera());
        if (camera == null) {
            throw new IllegalStateException("Camera '" + props.getCamera() + "' not found in simulator.cameras. "
                    + "Available cameras: " + props.getCameras().keySet());
        }
        if (isBlank(camera.getVideo()) || isBlank(camera.getApiUrl())) {
            throw new IllegalStateException("Camera '" + props.getCamera() + "' needs both video and api-url");
        }
        SimulatorProperties.Defaults d = props.getDefaults();
        checkGeometry(d);

        return CameraSettings.builder()
                .cameraName(props.getCamera())
                .videoPath(camera.getVideo())
                .downloadUrl(isBlank(camera.getDownloadUrl()) ? null : camera.getDownloadUrl())
                .apiUrl(camera.getApiUrl())
                .rtspPort(camera.getRtspPort())
                .fps(camera.getFps())
                .originalWidth(d.getOriginalWidth())
                .originalHeight(d.getOriginalHeight())
                .frameWidth(d.getFrameWidth())
                .frameHeight(d.getFrameHeight())
                .qrcodeSize(d.getQrcodeSize())
                .queueSize(d.getQueueSize())
                .eventQueueSize(d.getEventQueueSize())
                .warmupFrames(d.getWarmupFrames())
                .zone(zoneOrUtc(d.getTimezone()))
                .mountPath(normalizeMountPath(d.getMountPath()))
                .requestTimeout(d.getRequestTimeout())
                .gracePeriod(d.getGracePeriod())
                .pollTimeout(d.getPollTimeout())
                .offerTimeout(d.getOfferTimeout())
                .eventOfferTimeout(d.getEventOfferTimeout())
                .restartBackoff(d.getRestartBackoff())
                .statsInterval(d.getStatsInterval())
                .fpsLogInterval(d.getFpsLogInterval())
                .maxSessions(d.getMaxSessions())
                .overlayEnabled(d.isOverlayEnabled())
                .build();
    }

    private static void checkGeometry(SimulatorProperties.Defaults d) {
        if (d.getFrameWidth() > d.getOriginalWidth() || d.getFrameHeight() > d.getOriginalHeight()) {
            throw new IllegalStateException(String.format("Frame size %dx%d exceeds original size %dx%d",
                    d.getFrameWidth(), d.getFrameHeight(), d.getOriginalWidth(), d.getOriginalHeight()));
        }
        if (d.getQrcodeSize() > Math.min(d.getOriginalWidth(), d.getOriginalHeight())) {
            throw new IllegalStateException("qrcode-size " + d.getQrcodeSize() + " does not fit the original frame");
        }
        boolean overlaps = d.getFrameWidth() > d.getOriginalWidth() - d.getQrcodeSize()
                && d.getFrameHeight() > d.getOriginalHeight() - d.getQrcodeSize();
        if (overlaps) {
            throw new IllegalStateException("Primary frame region overlaps the QR code region");
        }
    }

    static ZoneId zoneOrUtc(String timezone) {
        if (isBlank(timezone)) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            logger.warn("Unknown timezone '{}', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    private static String normalizeMountPath(String path) {
        String p = path.startsWith("/") ? path : "/" + path;
        return p.length() > 1 && p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
