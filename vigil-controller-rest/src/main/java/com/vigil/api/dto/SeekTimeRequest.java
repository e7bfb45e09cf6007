package com.vigil.api.dto;

import com.vigil.service.core.model.MediaType;
import com.vigil.service.core.model.ViewMedia;
import com.vigil.service.core.query.EngineOptions;
import java.time.Instant;

/** Where to seek to reach {@code target} in the media of {@code cameraId} spanning {@code mediaStart..mediaEnd}. */
public record SeekTimeRequest(String cameraId, Instant mediaStart, Instant mediaEnd, Instant target, Boolean useCache) {

    public ViewMedia toMedia() {
        if (cameraId == null || cameraId.isBlank()) {
            throw new IllegalArgumentException("cameraId is required");
        }
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
        return ViewMedia.builder()
                .mediaType(MediaType.RECORDING)
                .cameraId(cameraId)
                .startTime(mediaStart)
                .endTime(mediaEnd)
                .build();
    }

    public EngineOptions options() {
        return DtoSupport.options(useCache);
    }
}
