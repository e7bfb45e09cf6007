package com.vigil.service.core.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "vigil")
public class FederationProperties {
    /** Zone the backend summarises days and hours in. Defaults to the JVM zone. */
    private String timezone;

    private int eventLimitDefault = 10000;
    private Cache cache = new Cache();
    private Segments segments = new Segments();
    private Federation federation = new Federation();
    private Transport transport = new Transport();
    private List<Camera> cameras = new ArrayList<>();

    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getEventLimitDefault() {
        return eventLimitDefault;
    }

    public void setEventLimitDefault(int eventLimitDefault) {
        this.eventLimitDefault = eventLimitDefault;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Segments getSegments() {
        return segments;
    }

    public void setSegments(Segments segments) {
        this.segments = segments;
    }

    public Federation getFederation() {
        return federation;
    }

    public void setFederation(Federation federation) {
        this.federation = federation;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public List<Camera> getCameras() {
        return cameras;
    }

    public void setCameras(List<Camera> cameras) {
        this.cameras = cameras;
    }

    public static class Cache {
        private Duration eventMaxAge = Duration.ofSeconds(60);
        private Duration recordingSummaryMaxAge = Duration.ofSeconds(60);
        private Duration mediaMetadataMaxAge = Duration.ofSeconds(60);
        private long maximumSize = 10000;

        public Duration getEventMaxAge() {
            return eventMaxAge;
        }

        public void setEventMaxAge(Duration eventMaxAge) {
            this.eventMaxAge = eventMaxAge;
        }

        public Duration getRecordingSummaryMaxAge() {
            return recordingSummaryMaxAge;
        }

        public void setRecordingSummaryMaxAge(Duration recordingSummaryMaxAge) {
            this.recordingSummaryMaxAge = recordingSummaryMaxAge;
        }

        public Duration getMediaMetadataMaxAge() {
            return mediaMetadataMaxAge;
        }

        public void setMediaMetadataMaxAge(Duration mediaMetadataMaxAge) {
            this.mediaMetadataMaxAge = mediaMetadataMaxAge;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    public static class Segments {
        private Duration gcCooldown = Duration.ofHours(1);

        public Duration getGcCooldown() {
            return gcCooldown;
        }

        public void setGcCooldown(Duration gcCooldown) {
            this.gcCooldown = gcCooldown;
        }
    }

    public static class Federation {
        private int workers = 8;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Transport {
        private String url;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    public static class Camera {
        private String id;
        private String instanceId;
        private String cameraName;
        private String title;
        private List<String> labels;
        private List<String> zones;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getInstanceId() {
            return instanceId;
        }

        public void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }

        public String getCameraName() {
            return cameraName;
        }

        public void setCameraName(String cameraName) {
            this.cameraName = cameraName;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public List<String> getLabels() {
            return labels;
        }

        public void setLabels(List<String> labels) {
            this.labels = labels;
        }

        public List<String> getZones() {
            return zones;
        }

        public void setZones(List<String> zones) {
            this.zones = zones;
        }
    }
}
