package com.vigil.service.core.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A configured camera and where it lives: the backend instance that serves it and the name the backend
 * knows it by. {@code labels}/{@code zones} are default event filters; null means no default.
 */
public record CameraConfig(
        String id, String instanceId, String cameraName, String title, List<String> labels, List<String> zones) {

    public static final String BIRDSEYE = "birdseye";

    public CameraConfig {
        Objects.requireNonNull(id, "id");
        labels = labels == null ? null : List.copyOf(labels);
        zones = zones == null ? null : List.copyOf(zones);
    }

    /** The backend's composite view is not a real camera and has no events or recordings. */
    public boolean isBirdseye() {
        return BIRDSEYE.equals(cameraName);
    }

    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (cameraName != null && !cameraName.isBlank()) {
            return prettify(cameraName);
        }
        return id;
    }

    public static String prettify(String input) {
        StringBuilder sb = new StringBuilder(input.length());
        for (String word : input.split("[_\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }
}
