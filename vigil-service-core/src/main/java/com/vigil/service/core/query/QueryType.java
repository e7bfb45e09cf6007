package com.vigil.service.core.query;

public enum QueryType {
    EVENT,
    RECORDING,
    RECORDING_SEGMENTS,
    MEDIA_METADATA
}
