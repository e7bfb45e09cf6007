package com.vigil.client.transport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Event search as the backend understands it. Null fields are left out of the request. */
public record NativeEventQuery(
        String instanceId,
        List<String> cameras,
        List<String> labels,
        List<String> zones,
        List<String> subLabels,
        Long after,
        Long before,
        Integer limit,
        Boolean hasClip,
        Boolean hasSnapshot,
        Boolean favorites) {

    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        putIfPresent(params, "instance_id", instanceId);
        putIfPresent(params, "cameras", cameras);
        putIfPresent(params, "labels", labels);
        putIfPresent(params, "zones", zones);
        putIfPresent(params, "sub_labels", subLabels);
        putIfPresent(params, "after", after);
        putIfPresent(params, "before", before);
        putIfPresent(params, "limit", limit);
        putIfPresent(params, "has_clip", hasClip);
        putIfPresent(params, "has_snapshot", hasSnapshot);
        putIfPresent(params, "favorites", favorites);
        return params;
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }
}
