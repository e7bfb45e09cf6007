package com.vigil.service.core.results;

import com.vigil.service.core.model.MediaMetadata;
import java.time.Instant;

/** Metadata merged across every instance the query touched, hence no single {@code instanceId}. */
public record MediaMetadataQueryResults(MediaMetadata metadata, Instant expiry, boolean cached)
        implements QueryResults {

    @Override
    public QueryResultsType type() {
        return QueryResultsType.MEDIA_METADATA;
    }

    @Override
    public String instanceId() {
        return null;
    }

    @Override
    public MediaMetadataQueryResults asCached() {
        return new MediaMetadataQueryResults(metadata, expiry, true);
    }
}
