package com.makestar.e2e.auth;

import java.util.Arrays;
import java.util.Objects;

/**
 * How much a loaded credential can be trusted. Assigned once when the material is loaded or harvested;
 * everything downstream reads the tag instead of re-inspecting token values.
 */
public enum CredentialQuality {
    /** Provider-issued token whose expiry claim decoded. */
    REAL,
    /** Placeholder material written by fixtures or by hand; never usable for gating. */
    SYNTHETIC,
    /** Opaque or undecodable token; expiry is a best-effort estimate. */
    UNKNOWN;

    private static final String[] MOCK_MARKERS = {"mock_session", "mock_token"};

    static boolean looksSynthetic(String... values) {
        return Arrays.stream(values)
            .filter(Objects::nonNull)
            .anyMatch(v -> Arrays.stream(MOCK_MARKERS).anyMatch(v::contains));
    }

    /**
     * Grades an access/refresh pair. The access token is the one whose {@code exp} claim sets the record expiry.
     */
    public static CredentialQuality assess(String accessToken, String refreshToken) {
        if (looksSynthetic(accessToken, refreshToken)) return SYNTHETIC;
        return TokenDecoder.tryDecodeExpiry(accessToken).isPresent() ? REAL : UNKNOWN;
    }
}
