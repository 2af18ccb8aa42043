package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns a logged-in browser into persisted session material: the site snapshot and, for sites that issue
 * tokens, the structured credential record.
 */
public class SessionHarvester {
    private static final Logger logger = LoggerFactory.getLogger(SessionHarvester.class);

    private final CredentialRepository repository;
    private final SessionCapture capture;
    private final TokenHarvester tokenHarvester;
    private final Clock clock;

    public SessionHarvester(CredentialRepository repository, SessionCapture capture, TokenHarvester tokenHarvester, Clock clock) {
        this.repository = repository;
        this.capture = capture;
        this.tokenHarvester = tokenHarvester;
        this.clock = clock;
    }

    public SessionCapture capture() {
        return capture;
    }

    /**
     * Captures and persists the browser's session.
     * <p>
     * On a token-issuing site a missing token pair is still a success when the captured cookies carry a
     * {@code refresh_token} that decodes and has not expired; only the snapshot is written in that case.
     * @return true when something usable was persisted
     */
    public boolean harvestAndPersist(BrowserSession session, TargetSite site) {
        SessionSnapshot snapshot = capture.capture(session, site);
        if (snapshot.isSynthetic()) {
            logger.warn("Captured {} session contains placeholder values; not saving it.", site);
            return false;
        }
        if (!site.issuesTokens()) {
            if (snapshot.cookies().isEmpty()) {
                logger.warn("No {} cookies present after login; nothing to save.", site);
                return false;
            }
            repository.saveSnapshot(site, snapshot);
            return true;
        }

        Optional<HarvestedTokens> tokens = tokenHarvester.harvest(session.page().url(), snapshot);
        if (tokens.isPresent()) {
            CredentialRecord record = tokenHarvester.toCredential(tokens.get());
            if (record.quality() == CredentialQuality.SYNTHETIC) {
                logger.warn("Harvested tokens look like placeholders; not saving them.");
                return false;
            }
            repository.save(record);
            repository.saveSnapshot(site, snapshot);
            logger.info("Saved {} credential for {} (expires {}, quality {}).",
                site, record.subject().email(), record.expiresAt(), record.quality());
            return true;
        }

        Optional<Instant> cookieExpiry = snapshot.cookie(TokenHarvester.REFRESH_TOKEN)
            .flatMap(c -> TokenDecoder.tryDecodeExpiry(c.value()));
        if (cookieExpiry.isPresent() && cookieExpiry.get().isAfter(clock.instant())) {
            repository.saveSnapshot(site, snapshot);
            logger.info("No token pair surfaced, but the refresh_token cookie is valid until {}; saved session only.",
                cookieExpiry.get());
            return true;
        }
        logger.warn("Login completed but no {} tokens or valid refresh cookie were found.", site);
        return false;
    }
}
