package com.vigil.service.core.cache;

import com.vigil.backend.model.RecordingSegment;
import com.vigil.range.MemoryRangeSet;
import com.vigil.range.Range;
import com.vigil.range.Ranges;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-camera store of recording segments plus the time windows that have been fetched in full. A window
 * inside a fetched one is answered from memory even if it was never asked for verbatim.
 *
 * <p>Evicting segments does not shrink the fetched windows: a window that has been garbage collected
 * still counts as covered and is answered with whatever segments remain.
 */
@Component
@Slf4j
public class RecordingSegmentsCache {

    private static final Comparator<RecordingSegment> OLDEST_FIRST =
            Comparator.comparing(RecordingSegment::startTime).thenComparing(RecordingSegment::id);

    private static final class CameraSegments {
        private final MemoryRangeSet coverage = new MemoryRangeSet();
        private final Map<String, RecordingSegment> segments = new LinkedHashMap<>();
    }

    private final Map<String, CameraSegments> cameras = new ConcurrentHashMap<>();

    /** Segments overlapping {@code range}, oldest first, or null when the range has not been fetched. */
    public List<RecordingSegment> get(String cameraId, Range<Instant> range) {
        CameraSegments camera = cameras.get(cameraId);
        if (camera == null) {
            return null;
        }
        synchronized (camera) {
            if (!camera.coverage.hasCoverage(range)) {
                return null;
            }
            return camera.segments.values().stream()
                    .filter(segment -> Ranges.overlaps(segment.range(), range))
                    .sorted(OLDEST_FIRST)
                    .toList();
        }
    }

    /** Records {@code range} as fetched and stores its segments. Segments already held (by id) are replaced. */
    public void add(String cameraId, Range<Instant> range, Collection<RecordingSegment> segments) {
        CameraSegments camera = cameras.computeIfAbsent(cameraId, id -> new CameraSegments());
        synchronized (camera) {
            for (RecordingSegment segment : segments) {
                camera.segments.put(segment.id(), segment);
            }
            camera.coverage.add(range);
        }
    }

    public Set<String> getCameraIds() {
        return Set.copyOf(cameras.keySet());
    }

    /** Drops every segment of {@code cameraId} that {@code predicate} accepts. Coverage is left alone. */
    public void expireMatches(String cameraId, Predicate<RecordingSegment> predicate) {
        CameraSegments camera = cameras.get(cameraId);
        if (camera == null) {
            return;
        }
        int removed;
        synchronized (camera) {
            int before = camera.segments.size();
            camera.segments.values().removeIf(predicate);
            removed = before - camera.segments.size();
        }
        if (removed > 0) {
            log.debug("Expired {} segment(s) for camera {}", removed, cameraId);
        }
    }

    public int size(String cameraId) {
        CameraSegments camera = cameras.get(cameraId);
        if (camera == null) {
            return 0;
        }
        synchronized (camera) {
            return camera.segments.size();
        }
    }
}
