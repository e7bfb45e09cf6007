package com.vigil.api.dto;

import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.RecordingSegmentsQuery;
import java.time.Instant;
import java.util.Set;

public record RecordingSegmentsQueryRequest(Set<String> cameraIds, Instant start, Instant end, Boolean useCache) {

    public RecordingSegmentsQuery toQuery() {
        return new RecordingSegmentsQuery(DtoSupport.requireCameras(cameraIds), start, end);
    }

    public EngineOptions options() {
        return DtoSupport.options(useCache);
    }
}
