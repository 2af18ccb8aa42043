package com.makestar.e2e.auth;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chromium launcher backed by a lazily created {@link Playwright} driver. Not thread-safe; each worker
 * owns one instance.
 */
public class PlaywrightBrowserLauncher implements BrowserLauncher, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserLauncher.class);

    private Playwright playwright;

    @Override
    public BrowserSession open(boolean headless) {
        if (playwright == null) {
            playwright = Playwright.create();
        }
        Browser browser = null;
        try {
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions().setViewportSize(1920, 1080));
            Page page = context.newPage();
            logger.debug("Launched {} chromium instance.", headless ? "headless" : "visible");
            return new BrowserSession(browser, context, page, headless);
        } catch (PlaywrightException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            if (browser != null) {
                browser.close();
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (playwright != null) {
            playwright.close();
            playwright = null;
        }
    }
}
