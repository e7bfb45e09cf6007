package com.vigil.service.core.query;

/** Per-call switches. {@code useCache=false} bypasses both reading and populating the caches. */
public record EngineOptions(boolean useCache) {

    public static final EngineOptions DEFAULT = new EngineOptions(true);
    public static final EngineOptions NO_CACHE = new EngineOptions(false);

    public static EngineOptions orDefault(EngineOptions options) {
        return options == null ? DEFAULT : options;
    }
}
