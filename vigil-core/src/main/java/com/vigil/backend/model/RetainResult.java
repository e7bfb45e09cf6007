package com.vigil.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetainResult(
        @JsonProperty(value = "success", required = true) boolean success,
        @JsonProperty("message") String message) {}
