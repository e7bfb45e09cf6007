package com.vigil.service.core.model;

import com.vigil.range.Range;
import java.time.Instant;

/**
 * One hour of recorded footage. {@code endTime} is the last millisecond of the hour, so a recording never
 * reaches into the next hour.
 */
public record Recording(String cameraId, Instant startTime, Instant endTime, int events) {

    public Range<Instant> range() {
        return Range.of(startTime, endTime);
    }
}
