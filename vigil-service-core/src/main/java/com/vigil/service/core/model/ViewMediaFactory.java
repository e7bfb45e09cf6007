package com.vigil.service.core.model;

import com.vigil.backend.model.BackendEvent;
import com.vigil.service.core.config.CameraConfig;
import java.util.List;
import java.util.Locale;

public final class ViewMediaFactory {

    private ViewMediaFactory() {}

    public static ViewMedia createEventViewMedia(
            MediaType mediaType, String cameraId, CameraConfig cameraConfig, BackendEvent event) {
        return ViewMedia.builder()
                .mediaType(mediaType)
                .cameraId(cameraId)
                .id(event.id())
                .startTime(event.startTime())
                .endTime(event.endTime())
                .inProgress(event.inProgress())
                .title(eventTitle(event, cameraConfig))
                .what(List.of(event.label()))
                .where(event.zones())
                .tags(event.subLabels())
                .score(event.topScore())
                .favorite(event.retainIndefinitely())
                .build();
    }

    public static ViewMedia createRecordingViewMedia(String cameraId, Recording recording, CameraConfig cameraConfig) {
        return ViewMedia.builder()
                .mediaType(MediaType.RECORDING)
                .cameraId(cameraId)
                .id(cameraId + "/" + recording.startTime().getEpochSecond() + "/" + recording.endTime().getEpochSecond())
                .startTime(recording.startTime())
                .endTime(recording.endTime())
                .title(cameraConfig.displayTitle())
                .what(List.of())
                .where(List.of())
                .tags(List.of())
                .eventCount(recording.events())
                .build();
    }

    private static String eventTitle(BackendEvent event, CameraConfig cameraConfig) {
        String label = CameraConfig.prettify(event.label());
        if (event.topScore() == null) {
            return cameraConfig.displayTitle() + ": " + label;
        }
        return String.format(
                Locale.ROOT, "%s: %s %d%%", cameraConfig.displayTitle(), label, Math.round(event.topScore() * 100));
    }
}
