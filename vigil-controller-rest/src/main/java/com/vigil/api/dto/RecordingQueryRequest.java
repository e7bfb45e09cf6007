package com.vigil.api.dto;

import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.RecordingQuery;
import java.time.Instant;
import java.util.Set;

public record RecordingQueryRequest(Set<String> cameraIds, Instant start, Instant end, Integer limit, Boolean useCache) {

    public RecordingQuery toQuery() {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new RecordingQuery(DtoSupport.requireCameras(cameraIds), start, end, limit);
    }

    public EngineOptions options() {
        return DtoSupport.options(useCache);
    }
}
