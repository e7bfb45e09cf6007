package com.vigil.service.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.backend.model.RecordingSegment;
import com.vigil.range.Range;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecordingSegmentsCacheTest {

    private static final Instant T0 = Instant.parse("2024-03-10T10:00:00Z");

    private final RecordingSegmentsCache cache = new RecordingSegmentsCache();

    @Test
    void uncoveredRangeIsAMiss() {
        assertThat(cache.get("front", range(0, 60))).isNull();

        cache.add("front", range(0, 600), List.of(segment("s1", 0, 10)));

        assertThat(cache.get("front", range(300, 700))).isNull();
        assertThat(cache.get("back", range(0, 60))).isNull();
    }

    @Test
    void coveredRangeReturnsOverlappingSegmentsOldestFirst() {
        cache.add("front", range(0, 600), List.of(segment("s3", 400, 410), segment("s1", 0, 10)));
        cache.add("front", range(600, 1200), List.of(segment("s2", 200, 210), segment("s4", 900, 910)));

        assertThat(cache.get("front", range(0, 1200)))
                .extracting(RecordingSegment::id)
                .containsExactly("s1", "s2", "s3", "s4");
        assertThat(cache.get("front", range(205, 405)))
                .extracting(RecordingSegment::id)
                .containsExactly("s2", "s3");
        assertThat(cache.getCameraIds()).containsExactly("front");
    }

    @Test
    void overlappingFetchesDoNotDuplicateSegments() {
        cache.add("front", range(0, 600), List.of(segment("s1", 0, 10), segment("s2", 500, 510)));
        cache.add("front", range(300, 900), List.of(segment("s2", 500, 510), segment("s3", 800, 810)));

        assertThat(cache.size("front")).isEqualTo(3);
    }

    @Test
    void expiringSegmentsLeavesCoverageInPlace() {
        cache.add("front", range(0, 600), List.of(segment("s1", 0, 10), segment("s2", 500, 510)));

        cache.expireMatches("front", segment -> segment.id().equals("s2"));
        cache.expireMatches("unknown", segment -> true);

        assertThat(cache.get("front", range(0, 600)))
                .extracting(RecordingSegment::id)
                .containsExactly("s1");
        assertThat(cache.get("front", range(400, 600))).isEmpty();
    }

    @Test
    void hourIdUsesTheGivenZone() {
        Instant instant = Instant.parse("2024-03-10T23:30:00Z");

        assertThat(HourId.of("front", instant, ZoneId.of("UTC")))
                .isEqualTo(new HourId("front", LocalDate.of(2024, 3, 10), 23));
        assertThat(HourId.of("front", instant, ZoneId.of("Europe/Paris")))
                .isEqualTo(new HourId("front", LocalDate.of(2024, 3, 11), 0));
        assertThat(HourId.of("front", instant, ZoneId.of("UTC")))
                .isNotEqualTo(HourId.of("front/10", instant, ZoneId.of("UTC")));
    }

    private static Range<Instant> range(long start, long end) {
        return Range.of(T0.plusSeconds(start), T0.plusSeconds(end));
    }

    private static RecordingSegment segment(String id, long start, long end) {
        return new RecordingSegment(id, T0.plusSeconds(start), T0.plusSeconds(end));
    }
}
