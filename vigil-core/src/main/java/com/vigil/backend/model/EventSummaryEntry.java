package com.vigil.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Per camera/day/label aggregate from the event summary endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventSummaryEntry(
        @JsonProperty(value = "camera", required = true) String camera,
        @JsonProperty(value = "day", required = true) String day,
        @JsonProperty("label") String label,
        @JsonProperty("sub_label") String subLabel,
        @JsonProperty("zones") List<String> zones,
        @JsonProperty("count") long count) {

    public EventSummaryEntry {
        zones = zones == null ? List.of() : List.copyOf(zones);
    }
}
