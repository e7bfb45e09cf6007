package com.vigil.client.transport;

import java.util.LinkedHashMap;
import java.util.Map;

/** Segments of one camera between two epoch-second bounds. */
public record NativeRecordingSegmentsQuery(String instanceId, String camera, long after, long before) {

    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("instance_id", instanceId);
        params.put("camera", camera);
        params.put("after", after);
        params.put("before", before);
        return params;
    }
}
