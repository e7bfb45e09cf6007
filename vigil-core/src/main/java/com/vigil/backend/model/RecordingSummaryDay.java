package com.vigil.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

/**
 * One day of the recording occupancy summary. Days and hours are relative to the timezone the summary was
 * requested in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingSummaryDay(
        @JsonProperty(value = "day", required = true) LocalDate day,
        @JsonProperty("events") int events,
        @JsonProperty(value = "hours", required = true) List<Hour> hours) {

    public RecordingSummaryDay {
        hours = hours == null ? List.of() : List.copyOf(hours);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Hour(
            @JsonProperty(value = "hour", required = true) int hour,
            @JsonProperty("events") int events,
            @JsonProperty("duration") double duration) {}
}
