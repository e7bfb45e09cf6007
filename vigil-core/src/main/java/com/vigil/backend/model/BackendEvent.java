package com.vigil.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Detection event as reported by a backend instance. {@code endTime} is absent while the event is still in
 * progress.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendEvent(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "camera", required = true) String camera,
        @JsonProperty(value = "label", required = true) String label,
        @JsonProperty("sub_label") String subLabel,
        @JsonProperty("zones") List<String> zones,
        @JsonProperty(value = "start_time", required = true) Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("top_score") Double topScore,
        @JsonProperty("has_clip") boolean hasClip,
        @JsonProperty("has_snapshot") boolean hasSnapshot,
        @JsonProperty("retain_indefinitely") boolean retainIndefinitely) {

    public BackendEvent {
        zones = zones == null ? List.of() : List.copyOf(zones);
    }

    public boolean inProgress() {
        return endTime == null;
    }

    /** Sub labels arrive comma-joined when several identities matched the same object. */
    public List<String> subLabels() {
        return SubLabels.split(subLabel);
    }
}
