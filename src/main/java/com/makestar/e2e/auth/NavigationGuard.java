package com.makestar.e2e.auth;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Navigation for tests that assume the session is already valid. A bounce to the login screen is treated
 * as session state that has not reached the browser yet: the stored snapshot is injected again and the
 * navigation retried. This never renews credentials.
 * <p>
 * Every login redirect consumes one unit of the redirect budget, and a retry happens only while budget
 * remains. With a budget of 2, two redirects in a row raise {@link AuthRedirectExhaustedException} even if a
 * third attempt would have succeeded. Navigation timeouts draw on a separate budget of the same size.
 */
public class NavigationGuard {
    private static final Logger logger = LoggerFactory.getLogger(NavigationGuard.class);

    static final long SETTLE_MS = 500;

    private final TargetSite site;
    private final CredentialRepository repository;
    private final SessionInjector injector;
    private final FailureCoordinator failureCoordinator;
    private final VerificationCache verificationCache;
    private final long navigationTimeoutMs;
    private final int defaultRetries;

    public NavigationGuard(TargetSite site, CredentialRepository repository, SessionInjector injector,
                           FailureCoordinator failureCoordinator, VerificationCache verificationCache,
                           long navigationTimeoutMs, int defaultRetries) {
        this.site = site;
        this.repository = repository;
        this.injector = injector;
        this.failureCoordinator = failureCoordinator;
        this.verificationCache = verificationCache;
        this.navigationTimeoutMs = navigationTimeoutMs;
        this.defaultRetries = defaultRetries;
    }

    public TargetSite site() {
        return site;
    }

    public void navigate(Page page, String url) {
        navigate(page, url, defaultRetries);
    }

    /**
     * Navigates and verifies the page did not end up on a login screen.
     * @param retriesRemaining login redirects tolerated before giving up
     * @throws AuthRedirectExhaustedException when the redirect budget runs out
     * @throws PlaywrightException when navigation keeps timing out
     */
    public void navigate(Page page, String url, int retriesRemaining) {
        int redirectBudget = retriesRemaining;
        int transportBudget = Math.max(1, retriesRemaining);
        while (true) {
            try {
                page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(navigationTimeoutMs));
            } catch (PlaywrightException e) {
                transportBudget--;
                if (transportBudget <= 0) {
                    logger.error("Navigation to {} failed: {}", url, e.getMessage());
                    throw e;
                }
                logger.warn("Navigation to {} failed ({} attempt(s) left): {}", url, transportBudget, e.getMessage());
                continue;
            }
            page.waitForTimeout(SETTLE_MS);

            String landed = page.url();
            if (!site.isLoginUrl(landed)) {
                failureCoordinator.clear();
                verificationCache.markVerified(site);
                return;
            }

            redirectBudget--;
            verificationCache.invalidate(site);
            if (redirectBudget <= 0) {
                logger.error("Still redirected to login after re-injecting the session: {}", landed);
                AuthRedirectExhaustedException failure = new AuthRedirectExhaustedException(landed, site.setupCommand());
                failureCoordinator.markFailed(failure.reason().name() + ": " + landed);
                throw failure;
            }
            logger.warn("Redirected to login ({}); re-injecting session, {} retr(ies) left.", landed, redirectBudget);
            reinject(page);
        }
    }

    private void reinject(Page page) {
        repository.loadSnapshot(site).ifPresentOrElse(
            snapshot -> injector.inject(page.context(), snapshot, site),
            () -> logger.warn("No stored {} session to re-inject.", site));
    }
}
