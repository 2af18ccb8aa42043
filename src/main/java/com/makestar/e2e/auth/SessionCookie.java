package com.makestar.e2e.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Optional;

/**
 * One browser cookie as it is stored in a snapshot file. {@code expires} is in epoch seconds; {@code null}
 * or a negative value marks a session cookie.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionCookie(
    String name,
    String value,
    String domain,
    String path,
    Double expires,
    boolean httpOnly,
    boolean secure,
    String sameSite
) {
    public SessionCookie {
        path = path == null || path.isBlank() ? "/" : path;
        sameSite = normalizeSameSite(sameSite);
    }

    @JsonIgnore
    public Optional<Instant> expiryInstant() {
        if (expires == null || expires < 0) return Optional.empty();
        return Optional.of(Instant.ofEpochMilli((long) (expires * 1000)));
    }

    private static String normalizeSameSite(String raw) {
        if (raw == null) return "Lax";
        switch (raw.trim().toLowerCase()) {
            case "strict":
                return "Strict";
            case "none":
                return "None";
            default:
                return "Lax";
        }
    }
}
