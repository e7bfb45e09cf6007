package com.vigil.api.dto;

public record RetainRequest(boolean retain) {}
