package com.vigil.service.core.query;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/** Hour-granular recordings; {@code limit} keeps only the most recent hours. */
public record RecordingQuery(Set<String> cameraIds, Instant start, Instant end, Integer limit) implements DataQuery {

    public RecordingQuery {
        cameraIds = Set.copyOf(Objects.requireNonNull(cameraIds, "cameraIds"));
    }

    public static RecordingQuery forCameras(Set<String> cameraIds) {
        return new RecordingQuery(cameraIds, null, null, null);
    }

    @Override
    public QueryType type() {
        return QueryType.RECORDING;
    }

    @Override
    public RecordingQuery withCameraIds(Set<String> cameraIds) {
        return new RecordingQuery(cameraIds, start, end, limit);
    }
}
