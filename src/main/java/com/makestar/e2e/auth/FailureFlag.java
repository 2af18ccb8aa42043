package com.makestar.e2e.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Process-shared marker that authentication is currently broken. {@code timestamp} is epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FailureFlag(boolean failed, String reason, long timestamp) {

    @JsonIgnore
    public Instant recordedAt() {
        return Instant.ofEpochMilli(timestamp);
    }
}
