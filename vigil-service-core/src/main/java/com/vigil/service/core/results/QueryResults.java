package com.vigil.service.core.results;

import java.time.Instant;

/**
 * The answer to one backend sub-query. {@code instanceId} names the backend that answered (null when the
 * result was assembled from several), {@code expiry} is when a cached copy stops being served (null for
 * results with no age limit) and {@code cached} marks a result that came out of a cache.
 */
public sealed interface QueryResults
        permits EventQueryResults, RecordingQueryResults, RecordingSegmentsQueryResults, MediaMetadataQueryResults {

    QueryResultsType type();

    String instanceId();

    Instant expiry();

    boolean cached();

    /** This result as it should be handed out when read back from a cache. */
    QueryResults asCached();
}
