package com.vigil.service.core.results;

import com.vigil.backend.model.RecordingSegment;
import java.time.Instant;
import java.util.List;

/** Segments are ordered oldest first. They live in the segment cache, so there is no expiry. */
public record RecordingSegmentsQueryResults(String instanceId, List<RecordingSegment> segments, boolean cached)
        implements QueryResults {

    public RecordingSegmentsQueryResults {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    @Override
    public QueryResultsType type() {
        return QueryResultsType.RECORDING_SEGMENTS;
    }

    @Override
    public Instant expiry() {
        return null;
    }

    @Override
    public RecordingSegmentsQueryResults asCached() {
        return new RecordingSegmentsQueryResults(instanceId, segments, true);
    }
}
