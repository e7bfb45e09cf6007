package com.vigil.client.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vigil.backend.model.BackendEvent;
import com.vigil.backend.model.EventSummaryEntry;
import com.vigil.backend.model.RecordingSegment;
import com.vigil.backend.model.RecordingSummaryDay;
import com.vigil.backend.model.RetainResult;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Factories for every request the federation engine issues. */
public final class BackendRequests {

    private BackendRequests() {}

    public static BackendRequest<List<BackendEvent>> events(NativeEventQuery query) {
        return new BackendRequest<>(RequestKind.EVENTS, query.toParameters(), new TypeReference<>() {});
    }

    /** Summary days are computed relative to {@code timezone}, so it changes the answer. */
    public static BackendRequest<List<EventSummaryEntry>> eventSummary(String instanceId, ZoneId timezone) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("instance_id", instanceId);
        params.put("timezone", timezone.getId());
        return new BackendRequest<>(RequestKind.EVENT_SUMMARY, params, new TypeReference<>() {});
    }

    public static BackendRequest<List<RecordingSummaryDay>> recordingsSummary(
            String instanceId, String cameraName, ZoneId timezone) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("instance_id", instanceId);
        params.put("camera", cameraName);
        params.put("timezone", timezone.getId());
        return new BackendRequest<>(RequestKind.RECORDINGS_SUMMARY, params, new TypeReference<>() {});
    }

    public static BackendRequest<List<RecordingSegment>> recordingSegments(NativeRecordingSegmentsQuery query) {
        return new BackendRequest<>(RequestKind.RECORDING_SEGMENTS, query.toParameters(), new TypeReference<>() {});
    }

    public static BackendRequest<RetainResult> retainEvent(String instanceId, String eventId, boolean retain) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("instance_id", instanceId);
        params.put("event_id", eventId);
        params.put("retain", retain);
        return new BackendRequest<>(RequestKind.EVENT_RETAIN, params, new TypeReference<>() {});
    }
}
