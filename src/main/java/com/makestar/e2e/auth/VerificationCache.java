package com.makestar.e2e.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-worker memory of "authentication already verified", so consecutive tests in one worker skip the
 * file reads. Entries expire after a short TTL.
 */
public class VerificationCache {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Clock clock;
    private final Duration ttl;
    private final Map<TargetSite, Instant> verifiedAt = new EnumMap<>(TargetSite.class);

    public VerificationCache(Clock clock) {
        this(clock, DEFAULT_TTL);
    }

    public VerificationCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public synchronized boolean isFresh(TargetSite site) {
        Instant at = verifiedAt.get(site);
        return at != null && at.plus(ttl).isAfter(clock.instant());
    }

    public synchronized void markVerified(TargetSite site) {
        verifiedAt.put(site, clock.instant());
    }

    public synchronized void invalidate(TargetSite site) {
        verifiedAt.remove(site);
    }
}
