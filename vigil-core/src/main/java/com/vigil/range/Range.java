package com.vigil.range;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval over an ordered scalar (an {@link Instant} or a numeric offset). Immutable; widening
 * produces a new instance.
 */
public record Range<T extends Comparable<? super T>>(T start, T end) {

    public Range {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static <T extends Comparable<? super T>> Range<T> of(T start, T end) {
        return new Range<>(start, end);
    }

    public boolean contains(T value) {
        return value.compareTo(start) >= 0 && value.compareTo(end) <= 0;
    }

    Range<T> withEnd(T newEnd) {
        return new Range<>(start, newEnd);
    }
}
