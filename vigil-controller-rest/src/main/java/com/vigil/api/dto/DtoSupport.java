package com.vigil.api.dto;

import com.vigil.service.core.query.EngineOptions;
import java.util.Set;

final class DtoSupport {

    private DtoSupport() {}

    static Set<String> requireCameras(Set<String> cameraIds) {
        if (cameraIds == null) {
            throw new IllegalArgumentException("cameraIds is required");
        }
        if (cameraIds.contains(null)) {
            throw new IllegalArgumentException("cameraIds must not contain null");
        }
        return cameraIds;
    }

    static EngineOptions options(Boolean useCache) {
        return useCache == null ? EngineOptions.DEFAULT : new EngineOptions(useCache);
    }
}
