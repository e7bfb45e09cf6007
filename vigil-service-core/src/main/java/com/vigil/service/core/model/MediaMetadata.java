package com.vigil.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Set;

/**
 * Everything a media browser can filter by. A facet with no values is null rather than empty. Days are ISO
 * dates in the backend's timezone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaMetadata(Set<String> what, Set<String> where, Set<String> days, Set<String> tags) {

    public MediaMetadata {
        what = nullIfEmpty(what);
        where = nullIfEmpty(where);
        days = nullIfEmpty(days);
        tags = nullIfEmpty(tags);
    }

    private static Set<String> nullIfEmpty(Set<String> values) {
        return values == null || values.isEmpty() ? null : Set.copyOf(values);
    }
}
