package com.makestar.e2e.auth;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Renews a session without a human by replaying the stored session through the identity provider's
 * redirect chain in a headless browser.
 * <p>
 * After the first navigation settles the browser is in one of three places:
 * <ol>
 *   <li>on the protected page: the session was still good, harvest it;</li>
 *   <li>on the login screen with the one-click federated button: click it and wait for the way back;</li>
 *   <li>on a login form that needs typed credentials: give up at once, only a human can continue.</li>
 * </ol>
 * The third case never waits on a timeout.
 */
public class SilentRenewer implements Renewer {
    private static final Logger logger = LoggerFactory.getLogger(SilentRenewer.class);

    static final long SETTLE_MS = 2_000;
    static final long BUTTON_VISIBLE_TIMEOUT_MS = 3_000;
    static final int RETURN_POLL_ATTEMPTS = 15;
    static final long RETURN_POLL_INTERVAL_MS = 500;

    private final BrowserLauncher launcher;
    private final CredentialRepository repository;
    private final SessionInjector injector;
    private final SessionHarvester harvester;
    private final long navigationTimeoutMs;
    private volatile RenewalState state = RenewalState.IDLE;

    public SilentRenewer(BrowserLauncher launcher, CredentialRepository repository, SessionInjector injector,
                         SessionHarvester harvester, long navigationTimeoutMs) {
        this.launcher = launcher;
        this.repository = repository;
        this.injector = injector;
        this.harvester = harvester;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    @Override
    public String name() {
        return "silent";
    }

    @Override
    public RenewalState state() {
        return state;
    }

    @Override
    public boolean attempt(TargetSite site) {
        state = RenewalState.ATTEMPTING;
        logger.info("Attempting silent {} renewal...", site);
        boolean renewed;
        try (BrowserSession session = launcher.open(true)) {
            repository.loadSnapshot(site).ifPresent(snapshot -> injector.inject(session.context(), snapshot, site));
            renewed = renew(session, site);
            if (!renewed && site.issuesTokens() && site.logoutUrl() != null && onProtectedOrigin(session, site)) {
                // Logged in but nothing harvestable: cycle the session once to make the provider reissue tokens.
                logger.info("Session is live but no tokens surfaced; logging out and back in once.");
                navigate(session.page(), site.logoutUrl());
                navigate(session.page(), site.loginEntryUrl());
                renewed = continueFromLoginScreen(session, site);
            }
        } catch (PlaywrightException e) {
            logger.warn("Silent renewal aborted: {}", e.getMessage());
            renewed = false;
        }
        state = renewed ? RenewalState.SUCCEEDED : RenewalState.FAILED;
        if (renewed) {
            logger.info("Silent {} renewal succeeded.", site);
        } else {
            logger.warn("Silent {} renewal failed.", site);
        }
        return renewed;
    }

    private boolean renew(BrowserSession session, TargetSite site) {
        Page page = session.page();
        navigate(page, entryUrl(site));
        page.waitForTimeout(SETTLE_MS);
        String current = page.url();
        if (site.isOnProtectedOrigin(current)) {
            logger.debug("Landed on {}; session still accepted.", current);
            return harvester.harvestAndPersist(session, site);
        }
        if (site.isLoginUrl(current)) {
            return continueFromLoginScreen(session, site);
        }
        logger.warn("Unexpected landing page during silent renewal: {}", current);
        return false;
    }

    private boolean continueFromLoginScreen(BrowserSession session, TargetSite site) {
        Page page = session.page();
        String selector = site.federatedButtonSelector();
        if (selector == null) {
            logger.info("{} has no one-click login; silent renewal cannot continue.", site);
            return false;
        }
        Locator button = page.locator(selector);
        if (!Utils.isVisibleWithin(button, BUTTON_VISIBLE_TIMEOUT_MS)) {
            logger.info("Login form requires credentials ({}); silent renewal cannot continue.", page.url());
            return false;
        }
        logger.info("Continuing with {} login...", site.federatedButtonText());
        button.first().click();
        boolean returned = Utils.pollUntil(page, () -> site.isOnProtectedOrigin(page.url()),
            RETURN_POLL_ATTEMPTS, RETURN_POLL_INTERVAL_MS, "return to " + site.baseHost());
        if (!returned) {
            logger.warn("Identity provider did not redirect back (stuck at {}).", page.url());
            return false;
        }
        return harvester.harvestAndPersist(session, site);
    }

    private boolean onProtectedOrigin(BrowserSession session, TargetSite site) {
        try {
            return site.isOnProtectedOrigin(session.page().url());
        } catch (PlaywrightException e) {
            return false;
        }
    }

    private void navigate(Page page, String url) {
        page.navigate(url, new Page.NavigateOptions()
            .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
            .setTimeout(navigationTimeoutMs));
    }

    /**
     * The protected entry point, carrying the stored refresh token on sites whose provider accepts it
     * as a query parameter.
     */
    String entryUrl(TargetSite site) {
        String url = site.protectedEntryUrl();
        if (!site.issuesTokens()) return url;
        Optional<CredentialRecord> record = repository.load();
        if (record.isEmpty() || record.get().quality() == CredentialQuality.SYNTHETIC
            || record.get().refreshToken() == null || record.get().refreshToken().isBlank()) {
            return url;
        }
        return url + "?refresh_token=" + URLEncoder.encode(record.get().refreshToken(), StandardCharsets.UTF_8);
    }
}
