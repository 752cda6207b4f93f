package com.scosim.simulator.service.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Camera name to device (SCO) id lookup.
 */
public class CameraDeviceDirectory {

    public static final String UNDEFINED_DEVICE_ID = "UNDEFINE_SCO_ID";

    private static final Logger logger = LoggerFactory.getLogger(CameraDeviceDirectory.class);

    private final Map<String, String> devices;

    public CameraDeviceDirectory(Map<String, String> devices) {
        this.devices = Map.copyOf(devices);
    }

    public String resolve(String cameraName) {
        String deviceId = cameraName == null ? null : devices.get(cameraName);
        if (deviceId == null || deviceId.isBlank()) {
            logger.warn("No device id for camera '{}', using {}", cameraName, UNDEFINED_DEVICE_ID);
            return UNDEFINED_DEVICE_ID;
        }
        return deviceId;
    }
}
