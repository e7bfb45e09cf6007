package com.vigil.api.dto;

import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.MediaMetadataQuery;
import java.util.Set;

public record MediaMetadataQueryRequest(Set<String> cameraIds, Boolean useCache) {

    public MediaMetadataQuery toQuery() {
        return new MediaMetadataQuery(DtoSupport.requireCameras(cameraIds));
    }

    public EngineOptions options() {
        return DtoSupport.options(useCache);
    }
}
