package com.vigil.range;

import java.time.Instant;

/**
 * Record of time ranges that are known to have been fetched completely.
 *
 * @param <R> the stored range shape
 */
public interface RangeSet<R> {

    /** True when a single stored range fully contains {@code range}. Partial overlap is a miss. */
    boolean hasCoverage(Range<Instant> range);

    void add(R range);

    void clear();
}
