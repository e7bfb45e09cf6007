package com.vigil.service.core.query;

import java.util.Objects;
import java.util.Set;

/** What labels, zones, days and tags exist for a set of cameras. */
public record MediaMetadataQuery(Set<String> cameraIds) implements DataQuery {

    public MediaMetadataQuery {
        cameraIds = Set.copyOf(Objects.requireNonNull(cameraIds, "cameraIds"));
    }

    @Override
    public QueryType type() {
        return QueryType.MEDIA_METADATA;
    }

    @Override
    public MediaMetadataQuery withCameraIds(Set<String> cameraIds) {
        return new MediaMetadataQuery(cameraIds);
    }
}
