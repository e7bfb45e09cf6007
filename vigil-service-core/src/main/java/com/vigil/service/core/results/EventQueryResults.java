package com.vigil.service.core.results;

import com.vigil.backend.model.BackendEvent;
import java.time.Instant;
import java.util.List;

public record EventQueryResults(String instanceId, List<BackendEvent> events, Instant expiry, boolean cached)
        implements QueryResults {

    public EventQueryResults {
        events = events == null ? List.of() : List.copyOf(events);
    }

    @Override
    public QueryResultsType type() {
        return QueryResultsType.EVENT;
    }

    @Override
    public EventQueryResults asCached() {
        return new EventQueryResults(instanceId, events, expiry, true);
    }
}
