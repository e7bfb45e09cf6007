package com.vigil.range;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Coverage set whose entries lapse individually. Entries are never merged: a merged range would have to
 * carry a single expiry for fragments that were fetched at different times.
 */
public class ExpiringMemoryRangeSet implements RangeSet<ExpiringRange> {

    private final Clock clock;
    private List<ExpiringRange> ranges = new ArrayList<>();

    public ExpiringMemoryRangeSet() {
        this(Clock.systemUTC());
    }

    public ExpiringMemoryRangeSet(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized boolean hasCoverage(Range<Instant> range) {
        Instant now = clock.instant();
        return ranges.stream()
                .anyMatch(cached -> cached.isLiveAt(now) && Ranges.isEntirelyContained(cached.range(), range));
    }

    @Override
    public synchronized void add(ExpiringRange range) {
        ranges.add(range);
        expireOldRanges();
    }

    @Override
    public synchronized void clear() {
        ranges = new ArrayList<>();
    }

    public synchronized int size() {
        return ranges.size();
    }

    private void expireOldRanges() {
        Instant now = clock.instant();
        ranges.removeIf(range -> !range.isLiveAt(now));
    }
}
