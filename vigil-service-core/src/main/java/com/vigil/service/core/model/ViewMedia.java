package com.vigil.service.core.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A playable or viewable item shown to the user: an event clip, an event snapshot or an hour of recording.
 * Only the favorite flag changes after construction.
 */
@Getter
@Builder
@ToString
public class ViewMedia {
    private final MediaType mediaType;
    private final String cameraId;
    /** Backend event id, or a synthetic id for recordings. */
    private final String id;

    private final Instant startTime;
    /** Null while an event is still in progress. */
    private final Instant endTime;

    private final boolean inProgress;
    private final String title;
    private final List<String> what;
    private final List<String> where;
    private final List<String> tags;
    private final Double score;
    private final Integer eventCount;

    @Setter
    private volatile boolean favorite;
}
