package com.vigil.service.core.query;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Event search. {@code what} are labels, {@code where} zones and {@code tags} sub labels; any null filter is
 * not applied.
 */
public record EventQuery(
        Set<String> cameraIds,
        Instant start,
        Instant end,
        Integer limit,
        Set<String> what,
        Set<String> where,
        Set<String> tags,
        Boolean hasClip,
        Boolean hasSnapshot,
        Boolean favorite)
        implements DataQuery {

    public EventQuery {
        cameraIds = Set.copyOf(Objects.requireNonNull(cameraIds, "cameraIds"));
        what = DataQuery.copyOrNull(what);
        where = DataQuery.copyOrNull(where);
        tags = DataQuery.copyOrNull(tags);
    }

    @Override
    public QueryType type() {
        return QueryType.EVENT;
    }

    @Override
    public EventQuery withCameraIds(Set<String> cameraIds) {
        return toBuilder().cameraIds(cameraIds).build();
    }

    public boolean wantsClip() {
        return Boolean.TRUE.equals(hasClip);
    }

    public boolean wantsSnapshot() {
        return Boolean.TRUE.equals(hasSnapshot);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .cameraIds(cameraIds)
                .start(start)
                .end(end)
                .limit(limit)
                .what(what)
                .where(where)
                .tags(tags)
                .hasClip(hasClip)
                .hasSnapshot(hasSnapshot)
                .favorite(favorite);
    }

    public static final class Builder {
        private Set<String> cameraIds = Set.of();
        private Instant start;
        private Instant end;
        private Integer limit;
        private Set<String> what;
        private Set<String> where;
        private Set<String> tags;
        private Boolean hasClip;
        private Boolean hasSnapshot;
        private Boolean favorite;

        private Builder() {}

        public Builder cameraIds(Set<String> cameraIds) {
            this.cameraIds = cameraIds;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder what(Set<String> what) {
            this.what = what;
            return this;
        }

        public Builder where(Set<String> where) {
            this.where = where;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder hasClip(Boolean hasClip) {
            this.hasClip = hasClip;
            return this;
        }

        public Builder hasSnapshot(Boolean hasSnapshot) {
            this.hasSnapshot = hasSnapshot;
            return this;
        }

        public Builder favorite(Boolean favorite) {
            this.favorite = favorite;
            return this;
        }

        /** Copies every non-null filter of {@code partial} over the current values. Camera ids are kept. */
        public Builder overrideWith(EventQuery partial) {
            if (partial == null) {
                return this;
            }
            if (partial.start() != null) start = partial.start();
            if (partial.end() != null) end = partial.end();
            if (partial.limit() != null) limit = partial.limit();
            if (partial.what() != null) what = partial.what();
            if (partial.where() != null) where = partial.where();
            if (partial.tags() != null) tags = partial.tags();
            if (partial.hasClip() != null) hasClip = partial.hasClip();
            if (partial.hasSnapshot() != null) hasSnapshot = partial.hasSnapshot();
            if (partial.favorite() != null) favorite = partial.favorite();
            return this;
        }

        public EventQuery build() {
            return new EventQuery(cameraIds, start, end, limit, what, where, tags, hasClip, hasSnapshot, favorite);
        }
    }
}
