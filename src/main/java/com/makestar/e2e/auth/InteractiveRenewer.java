package com.makestar.e2e.auth;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a visible browser on the site's login entry and waits, for a bounded time, for a human to finish
 * logging in. Used when silent renewal cannot proceed and for first-time setup.
 * <p>
 * A timeout is an expected outcome and is reported as {@code false}; the caller tells the operator how to
 * retry.
 */
public class InteractiveRenewer implements Renewer {
    private static final Logger logger = LoggerFactory.getLogger(InteractiveRenewer.class);

    static final long LOGIN_POLL_INTERVAL_MS = 2_000;
    static final int COOKIE_POLL_ATTEMPTS = 10;
    static final long COOKIE_POLL_INTERVAL_MS = 500;
    static final long BUTTON_VISIBLE_TIMEOUT_MS = 5_000;

    private final BrowserLauncher launcher;
    private final SessionHarvester harvester;
    private final long defaultWaitMs;
    private final long navigationTimeoutMs;
    private volatile RenewalState state = RenewalState.IDLE;

    public InteractiveRenewer(BrowserLauncher launcher, SessionHarvester harvester, long defaultWaitMs, long navigationTimeoutMs) {
        this.launcher = launcher;
        this.harvester = harvester;
        this.defaultWaitMs = defaultWaitMs;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    @Override
    public String name() {
        return "interactive";
    }

    @Override
    public RenewalState state() {
        return state;
    }

    @Override
    public boolean attempt(TargetSite site) {
        return attempt(site, defaultWaitMs);
    }

    /**
     * @param maxWaitMs how long the human gets to complete the login
     */
    public boolean attempt(TargetSite site, long maxWaitMs) {
        state = RenewalState.ATTEMPTING;
        boolean renewed;
        try (BrowserSession session = launcher.open(false)) {
            renewed = waitForLogin(session, site, maxWaitMs);
        } catch (PlaywrightException e) {
            logger.error("Interactive login aborted: {}", e.getMessage());
            renewed = false;
        }
        state = renewed ? RenewalState.SUCCEEDED : RenewalState.FAILED;
        return renewed;
    }

    private boolean waitForLogin(BrowserSession session, TargetSite site, long maxWaitMs) {
        Page page = session.page();
        page.navigate(site.loginEntryUrl(), new Page.NavigateOptions()
            .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
            .setTimeout(navigationTimeoutMs));

        String selector = site.federatedButtonSelector();
        if (selector != null) {
            Locator button = page.locator(selector);
            if (Utils.isVisibleWithin(button, BUTTON_VISIBLE_TIMEOUT_MS)) {
                button.first().click();
                logger.info("Clicked {} login; complete the sign-in in the browser window.", site.federatedButtonText());
            }
        }
        logger.info("Waiting up to {}s for {} login to complete...", maxWaitMs / 1000, site);

        int attempts = (int) Math.max(1, maxWaitMs / LOGIN_POLL_INTERVAL_MS);
        boolean loggedIn = Utils.pollUntil(page, () -> loginCompleted(site, page.url()),
            attempts, LOGIN_POLL_INTERVAL_MS, site + " login");
        if (!loggedIn) {
            logger.error("Login was not completed within {}s (last page: {}).", maxWaitMs / 1000, page.url());
            return false;
        }

        boolean cookiesPresent = Utils.pollUntil(page, () -> harvester.capture().hasSessionCookies(session, site),
            COOKIE_POLL_ATTEMPTS, COOKIE_POLL_INTERVAL_MS, site + " session cookies");
        if (!cookiesPresent) {
            logger.warn("Session cookies did not appear after login; saving what the browser has.");
        }
        return harvester.harvestAndPersist(session, site);
    }

    /**
     * Login is complete once the browser rests on the protected origin somewhere other than the login
     * entry page itself.
     */
    static boolean loginCompleted(TargetSite site, String url) {
        return site.isOnProtectedOrigin(url) && !url.startsWith(site.loginEntryUrl());
    }
}
