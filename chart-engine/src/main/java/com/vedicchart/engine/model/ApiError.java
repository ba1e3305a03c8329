package com.vedicchart.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ApiError(
    @JsonProperty("code") String code,
    @JsonProperty("message") String message,
    @JsonProperty("path") String path,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static ApiError of(String code, String message, String path) {
        return new ApiError(code, message, path, Instant.now());
    }
}
