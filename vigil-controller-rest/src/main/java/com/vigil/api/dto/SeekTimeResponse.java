package com.vigil.api.dto;

public record SeekTimeResponse(double seconds) {}
