package com.vigil.range;

import java.time.Instant;
import java.util.Objects;

/** A time range that stops counting as coverage once {@code expires} has passed. */
public record ExpiringRange(Range<Instant> range, Instant expires) {

    public ExpiringRange {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(expires, "expires");
    }

    public static ExpiringRange of(Instant start, Instant end, Instant expires) {
        return new ExpiringRange(Range.of(start, end), expires);
    }

    public boolean isLiveAt(Instant now) {
        return now.isBefore(expires);
    }
}
