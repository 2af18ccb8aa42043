package com.makestar.e2e.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Structured token material for the authenticated principal.
 * <p>
 * {@code expiresAt} comes from the access token's {@code exp} claim when it decodes; otherwise it is a
 * conservative estimate and {@link #quality()} is {@link CredentialQuality#UNKNOWN}. Records are overwritten
 * in place by each successful renewal and never deleted automatically.
 */
public record CredentialRecord(
    String accessToken,
    String refreshToken,
    SubjectIdentity subject,
    long userId,
    Instant expiresAt,
    Instant savedAt,
    CredentialQuality quality
) {
    /** Expiry used when neither the token nor client storage yields one. */
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(3);

    public CredentialRecord {
        subject = subject == null ? SubjectIdentity.unknown() : subject;
        quality = quality == null ? CredentialQuality.UNKNOWN : quality;
    }
}
