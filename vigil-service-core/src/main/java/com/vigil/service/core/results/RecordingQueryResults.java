package com.vigil.service.core.results;

import com.vigil.service.core.model.Recording;
import java.time.Instant;
import java.util.List;

public record RecordingQueryResults(String instanceId, List<Recording> recordings, Instant expiry, boolean cached)
        implements QueryResults {

    public RecordingQueryResults {
        recordings = recordings == null ? List.of() : List.copyOf(recordings);
    }

    @Override
    public QueryResultsType type() {
        return QueryResultsType.RECORDING;
    }

    @Override
    public RecordingQueryResults asCached() {
        return new RecordingQueryResults(instanceId, recordings, expiry, true);
    }
}
