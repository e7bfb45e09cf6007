package com.vigil.service.core.results;

public enum QueryResultsType {
    EVENT,
    RECORDING,
    RECORDING_SEGMENTS,
    MEDIA_METADATA
}
