package com.vigil.api.dto;

import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.EventQuery;
import java.time.Instant;
import java.util.Set;

public record EventQueryRequest(
        Set<String> cameraIds,
        Instant start,
        Instant end,
        Integer limit,
        Set<String> what,
        Set<String> where,
        Set<String> tags,
        Boolean hasClip,
        Boolean hasSnapshot,
        Boolean favorite,
        Boolean useCache) {

    public EventQuery toQuery() {
        return EventQuery.builder()
                .cameraIds(DtoSupport.requireCameras(cameraIds))
                .start(start)
                .end(end)
                .limit(limit)
                .what(what)
                .where(where)
                .tags(tags)
                .hasClip(hasClip)
                .hasSnapshot(hasSnapshot)
                .favorite(favorite)
                .build();
    }

    public EngineOptions options() {
        return DtoSupport.options(useCache);
    }
}
