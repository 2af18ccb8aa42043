package com.makestar.e2e.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cookie jar plus client-side storage captured from a browser, enough to resume a session elsewhere.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSnapshot(
    List<SessionCookie> cookies,
    @JsonProperty("localStorage") Map<String, String> storageEntries,
    Instant savedAt
) {
    public SessionSnapshot {
        cookies = cookies == null ? List.of() : List.copyOf(cookies);
        storageEntries = storageEntries == null ? Map.of() : Map.copyOf(storageEntries);
    }

    public Optional<SessionCookie> cookie(String name) {
        return cookies.stream().filter(c -> name.equals(c.name())).findFirst();
    }

    @JsonIgnore
    public boolean isSynthetic() {
        return cookies.stream().anyMatch(c -> CredentialQuality.looksSynthetic(c.value()));
    }
}
