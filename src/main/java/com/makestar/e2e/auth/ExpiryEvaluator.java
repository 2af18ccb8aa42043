package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether stored credentials can still be used.
 * <p>
 * An expiry is never compared with "now" directly: the gating buffer is subtracted first, and a credential
 * whose {@code expiresAt - buffer} is at or before now is {@link ExpiryStatus#EXPIRED}. The buffer is kept
 * small so a credential is used for as long as possible before an expensive renewal.
 * A second, larger proactive buffer only yields {@link ExpiryStatus#EXPIRING_SOON}, which still gates as
 * usable.
 */
public class ExpiryEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ExpiryEvaluator.class);

    private final Clock clock;
    private final long proactiveBufferMs;

    public ExpiryEvaluator(Clock clock, long proactiveBufferMs) {
        this.clock = clock;
        this.proactiveBufferMs = proactiveBufferMs;
    }

    /**
     * Classifies the structured record alone.
     */
    public ExpiryStatus classify(CredentialRecord record, long bufferMs) {
        if (record == null || record.expiresAt() == null) return ExpiryStatus.MISSING;
        if (record.quality() == CredentialQuality.SYNTHETIC) {
            logger.warn("Stored credential carries placeholder tokens; treating it as missing.");
            return ExpiryStatus.MISSING;
        }
        return classifyExpiry(record.expiresAt(), bufferMs);
    }

    /**
     * Classifies the record, falling back to the {@code refresh_token} cookie of the snapshot when the
     * record is absent or no longer usable. A cookie that does not decode contributes nothing.
     */
    public ExpiryStatus classify(CredentialRecord record, SessionSnapshot snapshot, long bufferMs) {
        ExpiryStatus primary = classify(record, bufferMs);
        if (primary.isUsable()) return primary;
        ExpiryStatus secondary = refreshCookieExpiry(snapshot)
            .map(exp -> classifyExpiry(exp, bufferMs))
            .orElse(ExpiryStatus.MISSING);
        if (secondary.isUsable()) {
            logger.debug("Record is {}, but the refresh_token cookie is still {}", primary, secondary);
            return secondary;
        }
        return primary == ExpiryStatus.MISSING ? secondary : primary;
    }

    /**
     * Classifies a cookie-only session: the latest expiry among the site's session cookies, read from the
     * cookie value's JWT claim when it has one and from the cookie attribute otherwise.
     */
    public ExpiryStatus classifySnapshot(SessionSnapshot snapshot, TargetSite site, long bufferMs) {
        return latestSessionExpiry(snapshot, site)
            .map(exp -> classifyExpiry(exp, bufferMs))
            .orElse(ExpiryStatus.MISSING);
    }

    /**
     * Longest remaining lifetime across the record and the refresh cookie; zero when neither is known.
     */
    public Duration remaining(CredentialRecord record, SessionSnapshot snapshot) {
        Instant now = clock.instant();
        Instant best = record == null || record.quality() == CredentialQuality.SYNTHETIC ? null : record.expiresAt();
        Optional<Instant> cookie = refreshCookieExpiry(snapshot);
        if (cookie.isPresent() && (best == null || cookie.get().isAfter(best))) best = cookie.get();
        if (best == null || !best.isAfter(now)) return Duration.ZERO;
        return Duration.between(now, best);
    }

    ExpiryStatus classifyExpiry(Instant expiresAt, long bufferMs) {
        Instant now = clock.instant();
        if (!expiresAt.minusMillis(bufferMs).isAfter(now)) return ExpiryStatus.EXPIRED;
        if (proactiveBufferMs > bufferMs && !expiresAt.minusMillis(proactiveBufferMs).isAfter(now)) {
            return ExpiryStatus.EXPIRING_SOON;
        }
        return ExpiryStatus.VALID;
    }

    private static Optional<Instant> refreshCookieExpiry(SessionSnapshot snapshot) {
        if (snapshot == null || snapshot.isSynthetic()) return Optional.empty();
        return snapshot.cookie(TokenHarvester.REFRESH_TOKEN)
            .map(SessionCookie::value)
            .flatMap(TokenDecoder::tryDecodeExpiry);
    }

    private static Optional<Instant> latestSessionExpiry(SessionSnapshot snapshot, TargetSite site) {
        if (snapshot == null || snapshot.isSynthetic()) return Optional.empty();
        return snapshot.cookies().stream()
            .filter(c -> site.allowsCookieDomain(c.domain()))
            .filter(c -> site.sessionCookieNames().isEmpty() || site.sessionCookieNames().contains(c.name()))
            .map(c -> TokenDecoder.tryDecodeExpiry(c.value()).or(c::expiryInstant))
            .flatMap(Optional::stream)
            .max(Instant::compareTo);
    }
}
