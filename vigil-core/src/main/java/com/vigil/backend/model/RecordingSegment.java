package com.vigil.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.range.Range;
import java.time.Instant;

/** A few seconds of recorded video for one camera. Times are epoch seconds on the wire. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingSegment(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "start_time", required = true) Instant startTime,
        @JsonProperty(value = "end_time", required = true) Instant endTime) {

    public Range<Instant> range() {
        return Range.of(startTime, endTime);
    }
}
