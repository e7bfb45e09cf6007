package com.vigil.service.core.config;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Read-only lookup of configured cameras. */
public interface CameraConfigStore {

    Optional<CameraConfig> getCameraConfig(String cameraId);

    /** Every configured camera keyed by id, in configuration order. */
    Map<String, CameraConfig> getCameraConfigEntries();

    default Collection<CameraConfig> getCameraConfigs(Set<String> cameraIds) {
        return getCameraConfigEntries().values().stream()
                .filter(config -> cameraIds.contains(config.id()))
                .toList();
    }
}
