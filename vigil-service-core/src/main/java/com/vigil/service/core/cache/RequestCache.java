package com.vigil.service.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.vigil.service.core.config.FederationProperties;
import com.vigil.service.core.query.DataQuery;
import com.vigil.service.core.query.QueryKeyCanonicalizer;
import com.vigil.service.core.results.QueryResults;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Query results keyed by query content. Every entry carries its own expiry instant; an expired entry is
 * never returned, even if Caffeine has not evicted it yet.
 */
@Component
@Slf4j
public class RequestCache {

    private record Entry(QueryResults value, Instant expiry) {}

    private final Clock clock;
    private final Cache<String, Entry> entries;

    @Autowired
    public RequestCache(FederationProperties properties, Clock clock) {
        this(properties.getCache().getMaximumSize(), clock);
    }

    public RequestCache(long maximumSize, Clock clock) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return nanosUntil(entry.expiry());
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return nanosUntil(entry.expiry());
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
        log.info("Initialized request cache size={}.", maximumSize);
    }

    public QueryResults get(DataQuery query) {
        String key = QueryKeyCanonicalizer.toKey(query);
        Entry entry = entries.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            entries.invalidate(key);
            return null;
        }
        log.debug("Request cache hit for {}", key);
        return entry.value();
    }

    public boolean has(DataQuery query) {
        return get(query) != null;
    }

    /** Stores {@code value} until {@code expiry}. A null expiry keeps it until size eviction. */
    public void set(DataQuery query, QueryResults value, Instant expiry) {
        entries.put(QueryKeyCanonicalizer.toKey(query), new Entry(value, expiry));
    }

    public void clear() {
        entries.invalidateAll();
    }

    private boolean isExpired(Entry entry) {
        return entry.expiry() != null && !clock.instant().isBefore(entry.expiry());
    }

    private long nanosUntil(Instant expiry) {
        if (expiry == null) {
            return Long.MAX_VALUE;
        }
        Duration remaining = Duration.between(clock.instant(), expiry);
        if (remaining.isNegative()) {
            return 0;
        }
        try {
            return remaining.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
