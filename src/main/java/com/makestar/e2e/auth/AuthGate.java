package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for test setup: makes sure a site has usable credentials before any test navigates.
 * <p>
 * The order is fixed. A live failure flag fails fast without touching a browser, even for a worker that
 * verified recently. A fresh per-worker verification then returns immediately, and a usable stored credential
 * returns without launching anything. Only then are
 * the renewers tried, in composition order, and the first success wins.
 */
public class AuthGate {
    private static final Logger logger = LoggerFactory.getLogger(AuthGate.class);

    private final AuthSettings settings;
    private final CredentialRepository repository;
    private final ExpiryEvaluator evaluator;
    private final FailureCoordinator failureCoordinator;
    private final VerificationCache verificationCache;
    private final Renewer silentRenewer;
    private final Renewer interactiveRenewer;

    public AuthGate(AuthSettings settings, CredentialRepository repository, ExpiryEvaluator evaluator,
                    FailureCoordinator failureCoordinator, VerificationCache verificationCache,
                    Renewer silentRenewer, Renewer interactiveRenewer) {
        this.settings = settings;
        this.repository = repository;
        this.evaluator = evaluator;
        this.failureCoordinator = failureCoordinator;
        this.verificationCache = verificationCache;
        this.silentRenewer = silentRenewer;
        this.interactiveRenewer = interactiveRenewer;
    }

    /**
     * Classifies the stored material for a site without launching a browser.
     */
    public AuthStatus status(TargetSite site) {
        Optional<SessionSnapshot> snapshot = repository.loadSnapshot(site);
        if (site.issuesTokens()) {
            CredentialRecord record = repository.load().orElse(null);
            ExpiryStatus expiry = evaluator.classify(record, snapshot.orElse(null), settings.tokenBufferMs());
            return new AuthStatus(site, expiry, evaluator.remaining(record, snapshot.orElse(null)));
        }
        ExpiryStatus expiry = evaluator.classifySnapshot(snapshot.orElse(null), site, settings.tokenBufferMs());
        return new AuthStatus(site, expiry, Duration.ZERO);
    }

    /**
     * Guarantees usable credentials for the site or throws.
     * @throws AuthenticationUnavailableException when another worker already recorded a failure, or when
     *         every renewer failed; the failure is recorded for the other workers in the second case
     */
    public void ensureAuthenticated(TargetSite site) {
        checkFailureFlag(site);
        if (verificationCache.isFresh(site)) {
            logger.debug("{} authentication verified recently; skipping checks.", site);
            return;
        }

        AuthStatus status = status(site);
        if (status.usable()) {
            if (status.expiry() == ExpiryStatus.EXPIRING_SOON) {
                logger.info("{} credential expires soon ({} left).", site, Utils.formatRemaining(status.remaining()));
            }
            verificationCache.markVerified(site);
            return;
        }

        logger.info("{} credential is {}; attempting renewal.", site, status.expiry());
        List<Renewer> renewers = composition();
        for (Renewer renewer : renewers) {
            if (renewer.attempt(site)) {
                logger.info("{} renewal via {} succeeded.", site, renewer.name());
                failureCoordinator.clear();
                verificationCache.markVerified(site);
                return;
            }
            logger.warn("{} renewal via {} failed.", site, renewer.name());
        }

        AuthFailureReason reason;
        if (renewers.contains(interactiveRenewer)) {
            reason = AuthFailureReason.INTERACTIVE_RENEWAL_TIMEOUT;
        } else {
            reason = status.expiry() == ExpiryStatus.MISSING
                ? AuthFailureReason.CREDENTIAL_MISSING : AuthFailureReason.EXPIRED;
        }
        failureCoordinator.markFailed(reason.name() + ": " + site + " renewal failed");
        throw new AuthenticationUnavailableException(reason,
            site + " credentials are " + status.expiry() + " and could not be renewed (" + reason.description() + ").",
            site.setupCommand());
    }

    /**
     * Fails fast when any worker recorded an authentication failure that is still within its TTL. Cheap
     * enough to run before every authenticated test.
     * @throws AuthenticationUnavailableException carrying the recorded failure reason
     */
    public void checkFailureFlag(TargetSite site) {
        Optional<FailureFlag> flag = failureCoordinator.isFailed();
        if (flag.isPresent()) {
            verificationCache.invalidate(site);
            throw new AuthenticationUnavailableException(AuthFailureReason.fromFlagReason(flag.get().reason()),
                "Authentication was marked as failed by another worker: " + flag.get().reason(), site.setupCommand());
        }
    }

    /**
     * Runs renewal as requested from the command line.
     * @return true when the site ends up with usable credentials
     */
    public boolean renew(TargetSite site, RenewalMode mode) {
        switch (mode) {
            case SETUP:
                return recordOutcome(site, interactiveRenewer.attempt(site));
            case FORCE:
                return recordOutcome(site, silentRenewer.attempt(site) || interactiveRenewer.attempt(site));
            case AUTO:
            case IF_NEEDED:
            default:
                AuthStatus status = status(site);
                if (status.usable()) {
                    logger.info("{} credential is still usable ({}).", site, Utils.formatRemaining(status.remaining()));
                    return true;
                }
                return recordOutcome(site, silentRenewer.attempt(site));
        }
    }

    private boolean recordOutcome(TargetSite site, boolean renewed) {
        if (renewed) {
            failureCoordinator.clear();
            verificationCache.markVerified(site);
        }
        return renewed;
    }

    List<Renewer> composition() {
        List<Renewer> renewers = new ArrayList<>();
        renewers.add(silentRenewer);
        if (settings.interactiveFallback()) {
            renewers.add(interactiveRenewer);
        }
        return renewers;
    }
}
