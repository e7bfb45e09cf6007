package com.vigil.service.core.model;

public enum MediaType {
    CLIP,
    SNAPSHOT,
    RECORDING;

    public boolean isEvent() {
        return this == CLIP || this == SNAPSHOT;
    }
}
