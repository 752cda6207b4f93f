package com.scosim.simulator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound from the {@code simulator} prefix of application.yml (or any other property source).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "simulator")
public class SimulatorProperties {

    /** Name of the entry in {@link #cameras} to simulate. */
    @NotBlank
    private String camera;

    @Valid
    private Map<String, CameraProperties> cameras = new LinkedHashMap<>();

    @Valid
    @NotNull
    private Defaults defaults = new Defaults();

    /** Camera name to device (SCO) id. */
    private Map<String, String> devices = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class CameraProperties {
        @NotBlank
        private String video;
        @NotBlank
        private String apiUrl;
        private String downloadUrl;
        @Min(1)
        @Max(65535)
        private int rtspPort = 8554;
        @Min(1)
        @Max(120)
        private int fps = 15;
    }

    @Getter
    @Setter
    public static class Defaults {
        @Min(1)
        private int originalWidth = 800;
        @Min(1)
        private int originalHeight = 640;
        @Min(1)
        private int frameWidth = 640;
        @Min(1)
        private int frameHeight = 480;
        @Min(21)
        private int qrcodeSize = 160;
        @Min(1)
        private int queueSize = 30;
        @Min(1)
        private int eventQueueSize = 100;
        @Min(0)
        private int warmupFrames = 90;
        private String timezone = "UTC";
        @NotBlank
        private String mountPath = "/simulation";
        @NotNull
        private Duration requestTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(2);
        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(1);
        @NotNull
        private Duration offerTimeout = Duration.ofSeconds(1);
        @NotNull
        private Duration eventOfferTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration restartBackoff = Duration.ofMillis(500);
        @Min(1)
        private int statsInterval = 100;
        @Min(1)
        private int fpsLogInterval = 300;
        @Min(2)
        private int maxSessions = 100;
        private boolean overlayEnabled = true;
    }
}
