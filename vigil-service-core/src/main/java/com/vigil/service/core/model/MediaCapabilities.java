package com.vigil.service.core.model;

public record MediaCapabilities(boolean canFavorite, boolean canDownload) {}
