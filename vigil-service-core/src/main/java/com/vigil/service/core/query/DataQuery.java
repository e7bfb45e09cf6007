package com.vigil.service.core.query;

import java.util.Set;

/**
 * A logical query over a set of cameras. Queries are values: two queries with the same content are the same
 * query, whatever set implementation they were built from.
 */
public sealed interface DataQuery permits EventQuery, RecordingQuery, RecordingSegmentsQuery, MediaMetadataQuery {

    QueryType type();

    Set<String> cameraIds();

    /** The same query narrowed (or widened) to {@code cameraIds}. */
    DataQuery withCameraIds(Set<String> cameraIds);

    static Set<String> copyOrNull(Set<String> values) {
        return values == null ? null : Set.copyOf(values);
    }
}
