package com.vigil.range;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/** Interval algebra shared by the coverage sets and the segment cache. */
public final class Ranges {

    private Ranges() {}

    /** True iff every point of {@code smaller} lies inside {@code bigger}. */
    public static <T extends Comparable<? super T>> boolean isEntirelyContained(Range<T> bigger, Range<T> smaller) {
        return smaller.start().compareTo(bigger.start()) >= 0
                && smaller.end().compareTo(bigger.end()) <= 0;
    }

    public static <T extends Comparable<? super T>> boolean overlaps(Range<T> a, Range<T> b) {
        return b.contains(a.start()) // a starts inside b
                || b.contains(a.end()) // a ends inside b
                || isEntirelyContained(a, b);
    }

    public static <T extends Comparable<? super T>> List<Range<T>> compress(Collection<Range<T>> ranges) {
        return compress(ranges, UnaryOperator.identity());
    }

    public static List<Range<Instant>> compress(Collection<Range<Instant>> ranges, Duration tolerance) {
        return compress(ranges, end -> end.plus(tolerance));
    }

    public static List<Range<Long>> compressOffsets(Collection<Range<Long>> ranges, long tolerance) {
        return compress(ranges, end -> end + tolerance);
    }

    /**
     * Sorts by start and coalesces every range whose start is at or before the running end (as widened by
     * {@code tolerance}) into the preceding one.
     */
    public static <T extends Comparable<? super T>> List<Range<T>> compress(
            Collection<Range<T>> ranges, UnaryOperator<T> tolerance) {
        List<Range<T>> sorted = new ArrayList<>(ranges);
        sorted.sort((a, b) -> a.start().compareTo(b.start()));

        List<Range<T>> compressed = new ArrayList<>();
        Range<T> current = null;
        for (Range<T> range : sorted) {
            if (current == null) {
                current = range;
                continue;
            }
            if (tolerance.apply(current.end()).compareTo(range.start()) >= 0) {
                if (range.end().compareTo(current.end()) > 0) {
                    current = current.withEnd(range.end());
                }
            } else {
                compressed.add(current);
                current = range;
            }
        }
        if (current != null) {
            compressed.add(current);
        }
        return compressed;
    }
}
