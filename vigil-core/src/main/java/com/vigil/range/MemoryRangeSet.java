package com.vigil.range;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Coverage set kept compressed after every insertion. */
public class MemoryRangeSet implements RangeSet<Range<Instant>> {

    private List<Range<Instant>> ranges;

    public MemoryRangeSet() {
        this(List.of());
    }

    public MemoryRangeSet(List<Range<Instant>> ranges) {
        this.ranges = Ranges.compress(ranges);
    }

    @Override
    public synchronized boolean hasCoverage(Range<Instant> range) {
        return ranges.stream().anyMatch(cached -> Ranges.isEntirelyContained(cached, range));
    }

    @Override
    public synchronized void add(Range<Instant> range) {
        List<Range<Instant>> next = new ArrayList<>(ranges);
        next.add(range);
        ranges = Ranges.compress(next);
    }

    @Override
    public synchronized void clear() {
        ranges = List.of();
    }

    public synchronized List<Range<Instant>> ranges() {
        return List.copyOf(ranges);
    }
}
