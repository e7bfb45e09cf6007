package com.vigil.service.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Camera store populated from {@code vigil.cameras[*]}. */
@Component
@Slf4j
public class PropertiesCameraConfigStore implements CameraConfigStore {

    private final Map<String, CameraConfig> cameras;

    @Autowired
    public PropertiesCameraConfigStore(FederationProperties properties) {
        this(properties.getCameras().stream()
                .map(c -> new CameraConfig(
                        c.getId(), c.getInstanceId(), c.getCameraName(), c.getTitle(), c.getLabels(), c.getZones()))
                .toList());
    }

    public PropertiesCameraConfigStore(List<CameraConfig> configs) {
        Map<String, CameraConfig> byId = new LinkedHashMap<>();
        for (CameraConfig config : configs) {
            if (byId.putIfAbsent(config.id(), config) != null) {
                throw new IllegalArgumentException("Duplicate camera id: " + config.id());
            }
        }
        this.cameras = Collections.unmodifiableMap(byId);
        log.info("Loaded {} camera configuration(s)", cameras.size());
    }

    @Override
    public Optional<CameraConfig> getCameraConfig(String cameraId) {
        return Optional.ofNullable(cameras.get(cameraId));
    }

    @Override
    public Map<String, CameraConfig> getCameraConfigEntries() {
        return cameras;
    }
}
