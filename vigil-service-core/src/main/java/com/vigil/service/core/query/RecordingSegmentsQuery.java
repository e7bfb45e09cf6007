package com.vigil.service.core.query;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/** Raw segments between two instants. Both bounds are needed for the query to be issued. */
public record RecordingSegmentsQuery(Set<String> cameraIds, Instant start, Instant end) implements DataQuery {

    public RecordingSegmentsQuery {
        cameraIds = Set.copyOf(Objects.requireNonNull(cameraIds, "cameraIds"));
    }

    @Override
    public QueryType type() {
        return QueryType.RECORDING_SEGMENTS;
    }

    @Override
    public RecordingSegmentsQuery withCameraIds(Set<String> cameraIds) {
        return new RecordingSegmentsQuery(cameraIds, start, end);
    }

    public boolean hasValidBounds() {
        return start != null && end != null && !start.isAfter(end);
    }
}
