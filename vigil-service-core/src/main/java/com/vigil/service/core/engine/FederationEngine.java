package com.vigil.service.core.engine;

import com.vigil.backend.model.BackendEvent;
import com.vigil.backend.model.EventSummaryEntry;
import com.vigil.backend.model.RecordingSegment;
import com.vigil.backend.model.RecordingSummaryDay;
import com.vigil.backend.model.RetainResult;
import com.vigil.backend.model.SubLabels;
import com.vigil.client.transport.BackendRequest;
import com.vigil.client.transport.BackendRequests;
import com.vigil.client.transport.BackendTransport;
import com.vigil.client.transport.NativeEventQuery;
import com.vigil.client.transport.NativeRecordingSegmentsQuery;
import com.vigil.range.Range;
import com.vigil.service.core.cache.HourId;
import com.vigil.service.core.cache.RecordingSegmentsCache;
import com.vigil.service.core.cache.RequestCache;
import com.vigil.service.core.config.CameraConfig;
import com.vigil.service.core.config.CameraConfigStore;
import com.vigil.service.core.config.FederationConfig;
import com.vigil.service.core.config.FederationProperties;
import com.vigil.service.core.model.MediaCapabilities;
import com.vigil.service.core.model.MediaMetadata;
import com.vigil.service.core.model.MediaType;
import com.vigil.service.core.model.Recording;
import com.vigil.service.core.model.ViewMedia;
import com.vigil.service.core.model.ViewMediaFactory;
import com.vigil.service.core.query.DataQuery;
import com.vigil.service.core.query.EngineOptions;
import com.vigil.service.core.query.EventQuery;
import com.vigil.service.core.query.MediaMetadataQuery;
import com.vigil.service.core.query.RecordingQuery;
import com.vigil.service.core.query.RecordingSegmentsQuery;
import com.vigil.service.core.results.EventQueryResults;
import com.vigil.service.core.results.MediaMetadataQueryResults;
import com.vigil.service.core.results.QueryResults;
import com.vigil.service.core.results.QueryResultsClassifier;
import com.vigil.service.core.results.RecordingQueryResults;
import com.vigil.service.core.results.RecordingSegmentsQueryResults;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Splits logical queries into per-backend sub-queries, answers what it can from the caches, issues the rest
 * concurrently and hands back one result per sub-query.
 *
 * <p>Event and media metadata queries are issued once per backend instance; recording and segment queries
 * once per camera since the backend cannot answer those for several cameras at a time. Every query method
 * returns null when no sub-query could be formed. A failing remote call fails the whole call with the
 * transport's own exception.
 */
@Service
@Slf4j
public class FederationEngine {

    private final BackendTransport transport;
    private final CameraConfigStore cameraStore;
    private final RequestCache requestCache;
    private final RecordingSegmentsCache segmentsCache;
    private final FederationProperties properties;
    private final Clock clock;
    private final Executor executor;
    private final TrailingThrottle segmentGc;

    public FederationEngine(
            BackendTransport transport,
            CameraConfigStore cameraStore,
            RequestCache requestCache,
            RecordingSegmentsCache segmentsCache,
            FederationProperties properties,
            Clock clock,
            @Qualifier(FederationConfig.FEDERATION_EXECUTOR) Executor executor,
            @Qualifier(FederationConfig.SEGMENT_GC_SCHEDULER) TaskScheduler scheduler) {
        this.transport = transport;
        this.cameraStore = cameraStore;
        this.requestCache = requestCache;
        this.segmentsCache = segmentsCache;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
        this.segmentGc = new TrailingThrottle(
                "segment garbage collection",
                scheduler,
                clock,
                properties.getSegments().getGcCooldown(),
                this::garbageCollectSegments);
    }

    // ---------------------------------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------------------------------

    public Map<EventQuery, EventQueryResults> getEvents(EventQuery query, EngineOptions engineOptions) {
        EngineOptions options = EngineOptions.orDefault(engineOptions);
        Map<EventQuery, EventQueryResults> output = new ConcurrentHashMap<>();
        Map<String, Set<String>> instances = groupByInstance(query.cameraIds());
        log.debug("Event query over {} camera(s) fans out to {} instance(s)", query.cameraIds().size(), instances.size());

        fanOut(instances.entrySet(), instance -> {
            EventQuery instanceQuery = query.withCameraIds(instance.getValue());
            if (options.useCache()) {
                EventQueryResults cached = QueryResultsClassifier.asEventResults(requestCache.get(instanceQuery));
                if (cached != null) {
                    output.put(instanceQuery, cached);
                    return;
                }
            }

            NativeEventQuery nativeQuery = toNativeQuery(instance.getKey(), instance.getValue(), query);
            List<BackendEvent> events = transport.request(BackendRequests.events(nativeQuery));
            Instant expiry = clock.instant().plus(properties.getCache().getEventMaxAge());
            EventQueryResults result = new EventQueryResults(instance.getKey(), events, expiry, false);
            if (options.useCache()) {
                requestCache.set(instanceQuery, result.asCached(), expiry);
            }
            output.put(instanceQuery, result);
        });
        return output.isEmpty() ? null : output;
    }

    private NativeEventQuery toNativeQuery(String instanceId, Set<String> cameraIds, EventQuery query) {
        return new NativeEventQuery(
                instanceId,
                sorted(cameraNames(cameraIds)),
                query.what() == null ? null : sorted(query.what()),
                query.where() == null ? null : sorted(query.where()),
                query.tags() == null ? null : sorted(query.tags()),
                query.start() == null ? null : query.start().getEpochSecond(),
                query.end() == null ? null : query.end().getEpochSecond(),
                query.limit() != null ? query.limit() : properties.getEventLimitDefault(),
                query.wantsClip() ? Boolean.TRUE : null,
                query.wantsSnapshot() ? Boolean.TRUE : null,
                Boolean.TRUE.equals(query.favorite()) ? Boolean.TRUE : null);
    }

    // ---------------------------------------------------------------------------------------------
    // Recordings
    // ---------------------------------------------------------------------------------------------

    public Map<RecordingQuery, RecordingQueryResults> getRecordings(
            RecordingQuery query, EngineOptions engineOptions) {
        EngineOptions options = EngineOptions.orDefault(engineOptions);
        Map<RecordingQuery, RecordingQueryResults> output = new ConcurrentHashMap<>();

        fanOut(query.cameraIds(), cameraId -> {
            RecordingQuery cameraQuery = query.withCameraIds(Set.of(cameraId));
            if (options.useCache()) {
                RecordingQueryResults cached =
                        QueryResultsClassifier.asRecordingResults(requestCache.get(cameraQuery));
                if (cached != null) {
                    output.put(cameraQuery, cached);
                    return;
                }
            }

            CameraConfig config = queryableCameraConfig(cameraId).orElse(null);
            if (config == null || config.cameraName() == null) {
                log.debug("Skipping recordings for camera {} with no backend camera", cameraId);
                return;
            }

            List<RecordingSummaryDay> summary = transport.request(BackendRequests.recordingsSummary(
                    config.instanceId(), config.cameraName(), properties.zoneId()));
            List<Recording> recordings = expandSummary(cameraId, summary, cameraQuery);

            Instant expiry = clock.instant().plus(properties.getCache().getRecordingSummaryMaxAge());
            RecordingQueryResults result = new RecordingQueryResults(config.instanceId(), recordings, expiry, false);
            if (options.useCache()) {
                requestCache.set(cameraQuery, result.asCached(), expiry);
            }
            output.put(cameraQuery, result);
        });
        return output.isEmpty() ? null : output;
    }

    /**
     * Turns the day/hour occupancy summary into whole-hour recordings inside the query bounds. The backend
     * cannot limit this endpoint, so a limit keeps the most recent hours.
     */
    List<Recording> expandSummary(String cameraId, List<RecordingSummaryDay> summary, RecordingQuery query) {
        ZoneId zone = properties.zoneId();
        List<Recording> recordings = new ArrayList<>();
        for (RecordingSummaryDay day : summary == null ? List.<RecordingSummaryDay>of() : summary) {
            for (RecordingSummaryDay.Hour hour : day.hours()) {
                ZonedDateTime startOfHour = day.day().atTime(hour.hour(), 0).atZone(zone);
                Instant start = startOfHour.toInstant();
                Instant end = startOfHour.plusHours(1).toInstant().minusMillis(1);
                if ((query.start() == null || !start.isBefore(query.start()))
                        && (query.end() == null || !end.isAfter(query.end()))) {
                    recordings.add(new Recording(cameraId, start, end, hour.events()));
                }
            }
        }

        if (query.limit() != null) {
            return recordings.stream()
                    .sorted(Comparator.comparing(Recording::startTime).reversed())
                    .limit(Math.max(0, query.limit()))
                    .toList();
        }
        return recordings;
    }

    // ---------------------------------------------------------------------------------------------
    // Recording segments
    // ---------------------------------------------------------------------------------------------

    public Map<RecordingSegmentsQuery, RecordingSegmentsQueryResults> getRecordingSegments(
            RecordingSegmentsQuery query, EngineOptions engineOptions) {
        EngineOptions options = EngineOptions.orDefault(engineOptions);
        if (!query.hasValidBounds()) {
            log.debug("Skipping segment query without valid bounds: {}", query);
            return null;
        }
        Range<Instant> range = Range.of(query.start(), query.end());
        Map<RecordingSegmentsQuery, RecordingSegmentsQueryResults> output = new ConcurrentHashMap<>();

        fanOut(query.cameraIds(), cameraId -> {
            RecordingSegmentsQuery cameraQuery = query.withCameraIds(Set.of(cameraId));
            CameraConfig config = queryableCameraConfig(cameraId).orElse(null);
            if (config == null || config.cameraName() == null) {
                log.debug("Skipping segments for camera {} with no backend camera", cameraId);
                return;
            }

            List<RecordingSegment> cached = options.useCache() ? segmentsCache.get(cameraId, range) : null;
            if (cached != null) {
                output.put(cameraQuery, new RecordingSegmentsQueryResults(config.instanceId(), cached, true));
                return;
            }

            NativeRecordingSegmentsQuery request = new NativeRecordingSegmentsQuery(
                    config.instanceId(),
                    config.cameraName(),
                    query.start().getEpochSecond(),
                    query.end().getEpochSecond());
            List<RecordingSegment> segments = transport.request(BackendRequests.recordingSegments(request));
            if (options.useCache()) {
                segmentsCache.add(cameraId, range, segments);
            }
            output.put(cameraQuery, new RecordingSegmentsQueryResults(config.instanceId(), segments, false));
        });

        segmentGc.trigger();
        return output.isEmpty() ? null : output;
    }

    // ---------------------------------------------------------------------------------------------
    // Media metadata
    // ---------------------------------------------------------------------------------------------

    public Map<MediaMetadataQuery, MediaMetadataQueryResults> getMediaMetadata(
            MediaMetadataQuery query, EngineOptions engineOptions) {
        EngineOptions options = EngineOptions.orDefault(engineOptions);
        if (options.useCache()) {
            MediaMetadataQueryResults cached =
                    QueryResultsClassifier.asMediaMetadataResults(requestCache.get(query));
            if (cached != null) {
                return Map.of(query, cached);
            }
        }

        Map<String, Set<String>> instances = groupByInstance(query.cameraIds());
        if (instances.isEmpty()) {
            return null;
        }

        Set<String> what = ConcurrentHashMap.newKeySet();
        Set<String> where = ConcurrentHashMap.newKeySet();
        Set<String> days = ConcurrentHashMap.newKeySet();
        Set<String> tags = ConcurrentHashMap.newKeySet();

        CompletableFuture<?>[] summaries = instances.entrySet().stream()
                .map(instance -> CompletableFuture.runAsync(
                        () -> {
                            Set<String> cameraNames = cameraNames(instance.getValue());
                            List<EventSummaryEntry> entries = transport.request(
                                    BackendRequests.eventSummary(instance.getKey(), properties.zoneId()));
                            for (EventSummaryEntry entry : entries == null ? List.<EventSummaryEntry>of() : entries) {
                                // The instance may serve cameras that are not configured here.
                                if (!cameraNames.contains(entry.camera())) {
                                    continue;
                                }
                                if (entry.label() != null) what.add(entry.label());
                                where.addAll(entry.zones());
                                if (entry.day() != null) days.add(entry.day());
                                tags.addAll(SubLabels.split(entry.subLabel()));
                            }
                        },
                        executor))
                .toArray(CompletableFuture[]::new);

        // Recordings fan out on the federation executor themselves, so they are collected from this thread.
        Set<String> queryable = instances.values().stream().flatMap(Set::stream).collect(Collectors.toSet());
        Map<RecordingQuery, RecordingQueryResults> recordings =
                getRecordings(RecordingQuery.forCameras(queryable), options);
        if (recordings != null) {
            ZoneId zone = properties.zoneId();
            for (RecordingQueryResults result : recordings.values()) {
                for (Recording recording : result.recordings()) {
                    days.add(recording.startTime().atZone(zone).toLocalDate().toString());
                }
            }
        }
        await(CompletableFuture.allOf(summaries));

        Instant expiry = clock.instant().plus(properties.getCache().getMediaMetadataMaxAge());
        MediaMetadataQueryResults result =
                new MediaMetadataQueryResults(new MediaMetadata(what, where, days, tags), expiry, false);
        if (options.useCache()) {
            requestCache.set(query, result.asCached(), expiry);
        }
        return Map.of(query, result);
    }

    // ---------------------------------------------------------------------------------------------
    // Seeking
    // ---------------------------------------------------------------------------------------------

    /**
     * Seconds of footage between the start of {@code media} and {@code target}, counting only time actually
     * covered by recording segments. Empty when the target is outside the media or no segments exist.
     */
    public Optional<Double> getMediaSeekTime(ViewMedia media, Instant target, EngineOptions engineOptions) {
        Instant start = media.getStartTime();
        Instant end = media.getEndTime();
        if (start == null || end == null || target.isBefore(start) || target.isAfter(end)) {
            return Optional.empty();
        }

        RecordingSegmentsQuery query = new RecordingSegmentsQuery(Set.of(media.getCameraId()), start, end);
        Map<RecordingSegmentsQuery, RecordingSegmentsQueryResults> results =
                getRecordingSegments(query, engineOptions);
        if (results == null) {
            return Optional.empty();
        }
        // One camera, so at most one result.
        return seekTimeInSegments(start, target, results.values().iterator().next().segments());
    }

    /** {@code segments} must be ordered oldest first. */
    static Optional<Double> seekTimeInSegments(Instant start, Instant target, List<RecordingSegment> segments) {
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        long seekMillis = 0;
        for (RecordingSegment segment : segments) {
            if (segment.startTime().isAfter(target)) {
                break;
            }
            Instant from = segment.startTime().isBefore(start) ? start : segment.startTime();
            Instant to = segment.endTime().isAfter(target) ? target : segment.endTime();
            seekMillis += Math.max(0, Duration.between(from, to).toMillis());
        }
        return Optional.of(seekMillis / 1000.0);
    }

    // ---------------------------------------------------------------------------------------------
    // Retain / favorite
    // ---------------------------------------------------------------------------------------------

    /**
     * Asks the backend to keep (or stop keeping) an event forever.
     *
     * @return false if the camera is not configured and nothing was sent
     * @throws RetainFailedException if the backend reports the change was not applied
     */
    public boolean retain(String cameraId, String eventId, boolean retain) {
        CameraConfig config = queryableCameraConfig(cameraId).orElse(null);
        if (config == null || config.instanceId() == null) {
            log.debug("Not retaining event {} on unconfigured camera {}", eventId, cameraId);
            return false;
        }
        BackendRequest<RetainResult> request = BackendRequests.retainEvent(config.instanceId(), eventId, retain);
        RetainResult result = transport.request(request);
        if (result == null || !result.success()) {
            throw new RetainFailedException(request.toMessage(), result);
        }
        log.info("Event {} on camera {} retain={}", eventId, cameraId, retain);
        return true;
    }

    /** Favoriting retains the underlying event. Recordings cannot be favorited and are left untouched. */
    public void favoriteMedia(ViewMedia media, boolean favorite) {
        if (!media.getMediaType().isEvent()) {
            return;
        }
        if (retain(media.getCameraId(), media.getId(), favorite)) {
            media.setFavorite(favorite);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Media projection
    // ---------------------------------------------------------------------------------------------

    /** Null unless {@code results} are event results. */
    public List<ViewMedia> generateMediaFromEvents(EventQuery query, QueryResults results) {
        EventQueryResults events = QueryResultsClassifier.asEventResults(results);
        if (events == null) {
            return null;
        }

        List<ViewMedia> output = new ArrayList<>();
        for (BackendEvent event : events.events()) {
            String cameraId = resolveCameraId(query, events.instanceId(), event.camera());
            CameraConfig config = cameraId == null ? null : queryableCameraConfig(cameraId).orElse(null);
            if (config == null) {
                continue;
            }
            MediaType mediaType = resolveMediaType(query, event);
            if (mediaType == null) {
                continue;
            }
            output.add(ViewMediaFactory.createEventViewMedia(mediaType, cameraId, config, event));
        }
        return output;
    }

    /**
     * Clip wins over snapshot unless the query asks for a specific type, in which case the event must have
     * it. Null when the event has nothing the query can show.
     */
    static MediaType resolveMediaType(EventQuery query, BackendEvent event) {
        if (!query.wantsClip() && !query.wantsSnapshot() && (event.hasClip() || event.hasSnapshot())) {
            return event.hasClip() ? MediaType.CLIP : MediaType.SNAPSHOT;
        }
        if (query.wantsSnapshot() && event.hasSnapshot()) {
            return MediaType.SNAPSHOT;
        }
        if (query.wantsClip() && event.hasClip()) {
            return MediaType.CLIP;
        }
        return null;
    }

    /** Null unless {@code results} are recording results. */
    public List<ViewMedia> generateMediaFromRecordings(RecordingQuery query, QueryResults results) {
        RecordingQueryResults recordings = QueryResultsClassifier.asRecordingResults(results);
        if (recordings == null) {
            return null;
        }

        List<ViewMedia> output = new ArrayList<>();
        for (Recording recording : recordings.recordings()) {
            queryableCameraConfig(recording.cameraId())
                    .ifPresent(config -> output.add(
                            ViewMediaFactory.createRecordingViewMedia(recording.cameraId(), recording, config)));
        }
        return output;
    }

    /**
     * A single-camera query owns everything it returns. Otherwise the camera is found by instance and
     * backend camera name; null if none matches.
     */
    String resolveCameraId(DataQuery query, String instanceId, String cameraName) {
        if (query.cameraIds().size() == 1) {
            return query.cameraIds().iterator().next();
        }
        for (Map.Entry<String, CameraConfig> entry : cameraStore.getCameraConfigEntries().entrySet()) {
            CameraConfig config = entry.getValue();
            if (Objects.equals(config.instanceId(), instanceId) && Objects.equals(config.cameraName(), cameraName)) {
                return entry.getKey();
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------------
    // Default queries
    // ---------------------------------------------------------------------------------------------

    /**
     * One batched query when every configured camera shares the same default labels and zones, otherwise one
     * query per configured camera with its own defaults. Non-null filters of {@code partial} override the
     * defaults. Null when none of the cameras is configured.
     */
    public List<EventQuery> generateDefaultEventQuery(Set<String> cameraIds, EventQuery partial) {
        Collection<CameraConfig> configs = cameraStore.getCameraConfigs(cameraIds);
        Set<List<String>> uniqueLabels = new HashSet<>();
        Set<List<String>> uniqueZones = new HashSet<>();
        for (CameraConfig config : configs) {
            uniqueLabels.add(config.labels());
            uniqueZones.add(config.zones());
        }

        if (uniqueLabels.size() == 1 && uniqueZones.size() == 1) {
            List<String> labels = uniqueLabels.iterator().next();
            List<String> zones = uniqueZones.iterator().next();
            return List.of(EventQuery.builder()
                    .cameraIds(cameraIds)
                    .what(labels == null ? null : Set.copyOf(labels))
                    .where(zones == null ? null : Set.copyOf(zones))
                    .overrideWith(partial)
                    .build());
        }

        List<EventQuery> output = new ArrayList<>();
        for (CameraConfig config : configs) {
            output.add(EventQuery.builder()
                    .cameraIds(Set.of(config.id()))
                    .what(config.labels() == null ? null : Set.copyOf(config.labels()))
                    .where(config.zones() == null ? null : Set.copyOf(config.zones()))
                    .overrideWith(partial)
                    .build());
        }
        return output.isEmpty() ? null : output;
    }

    public List<RecordingQuery> generateDefaultRecordingQuery(Set<String> cameraIds, RecordingQuery partial) {
        return List.of(partial == null
                ? RecordingQuery.forCameras(cameraIds)
                : new RecordingQuery(cameraIds, partial.start(), partial.end(), partial.limit()));
    }

    /** Null unless both bounds are given. */
    public List<RecordingSegmentsQuery> generateDefaultRecordingSegmentsQuery(
            Set<String> cameraIds, Instant start, Instant end) {
        if (start == null || end == null) {
            return null;
        }
        return List.of(new RecordingSegmentsQuery(cameraIds, start, end));
    }

    // ---------------------------------------------------------------------------------------------
    // Media helpers
    // ---------------------------------------------------------------------------------------------

    /** Path (relative to the host) that downloads {@code media}, or null if its camera is not configured. */
    public String getMediaDownloadPath(ViewMedia media) {
        CameraConfig config = cameraStore.getCameraConfig(media.getCameraId()).orElse(null);
        if (config == null || config.instanceId() == null) {
            return null;
        }
        if (media.getMediaType().isEvent()) {
            return "/api/frigate/" + config.instanceId()
                    + "/notifications/" + media.getId() + "/"
                    + (media.getMediaType() == MediaType.CLIP ? "clip.mp4" : "snapshot.jpg")
                    + "?download=true";
        }
        if (media.getStartTime() == null || media.getEndTime() == null) {
            return null;
        }
        return "/api/frigate/" + config.instanceId()
                + "/recording/" + config.cameraName()
                + "/start/" + media.getStartTime().getEpochSecond()
                + "/end/" + media.getEndTime().getEpochSecond()
                + "?download=true";
    }

    public MediaCapabilities getMediaCapabilities(ViewMedia media) {
        return new MediaCapabilities(media.getMediaType().isEvent(), true);
    }

    /** How long results of {@code query} may be served from cache; empty when they are not aged. */
    public Optional<Duration> getQueryResultMaxAge(DataQuery query) {
        return switch (query.type()) {
            case EVENT -> Optional.of(properties.getCache().getEventMaxAge());
            case RECORDING -> Optional.of(properties.getCache().getRecordingSummaryMaxAge());
            case RECORDING_SEGMENTS, MEDIA_METADATA -> Optional.empty();
        };
    }

    // ---------------------------------------------------------------------------------------------
    // Segment garbage collection
    // ---------------------------------------------------------------------------------------------

    /**
     * Drops cached segments whose hour no longer appears in the backend's recordings. Normally run by the
     * throttle after segment queries.
     */
    public void garbageCollectSegments() {
        Set<String> cameraIds = segmentsCache.getCameraIds();
        if (cameraIds.isEmpty()) {
            return;
        }
        Map<RecordingQuery, RecordingQueryResults> results =
                getRecordings(RecordingQuery.forCameras(cameraIds), EngineOptions.DEFAULT);
        if (results == null) {
            return;
        }

        ZoneId zone = properties.zoneId();
        for (Map.Entry<RecordingQuery, RecordingQueryResults> entry : results.entrySet()) {
            String cameraId = entry.getKey().cameraIds().iterator().next();
            Set<HourId> goodHours = new HashSet<>();
            for (Recording recording : entry.getValue().recordings()) {
                goodHours.add(HourId.of(cameraId, recording.startTime(), zone));
            }
            segmentsCache.expireMatches(
                    cameraId, segment -> !goodHours.contains(HourId.of(cameraId, segment.startTime(), zone)));
        }
        log.info("Garbage collected recording segments for {} camera(s)", results.size());
    }

    boolean isSegmentGcPending() {
        return segmentGc.isPending();
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    /** Configured, non-birdseye camera. */
    private Optional<CameraConfig> queryableCameraConfig(String cameraId) {
        return cameraStore.getCameraConfig(cameraId).filter(config -> !config.isBirdseye());
    }

    private Map<String, Set<String>> groupByInstance(Set<String> cameraIds) {
        Map<String, Set<String>> output = new LinkedHashMap<>();
        for (String cameraId : cameraIds) {
            queryableCameraConfig(cameraId)
                    .map(CameraConfig::instanceId)
                    .ifPresentOrElse(
                            instanceId -> output.computeIfAbsent(instanceId, id -> new LinkedHashSet<>())
                                    .add(cameraId),
                            () -> log.debug("Camera {} has no queryable backend instance", cameraId));
        }
        return output;
    }

    private Set<String> cameraNames(Set<String> cameraIds) {
        Set<String> output = new LinkedHashSet<>();
        for (String cameraId : cameraIds) {
            queryableCameraConfig(cameraId)
                    .map(CameraConfig::cameraName)
                    .ifPresent(output::add);
        }
        return output;
    }

    private static List<String> sorted(Collection<String> values) {
        return values.stream().sorted().toList();
    }

    /** Runs one branch per element on the federation executor and waits for all of them. */
    private <T> void fanOut(Collection<T> branches, Consumer<T> branch) {
        CompletableFuture<?>[] futures = branches.stream()
                .map(element -> CompletableFuture.runAsync(() -> branch.accept(element), executor))
                .toArray(CompletableFuture[]::new);
        await(CompletableFuture.allOf(futures));
    }

    private static void await(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
