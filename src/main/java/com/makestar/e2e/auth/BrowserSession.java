package com.makestar.e2e.auth;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One browser instance with a single context and page, closed as a unit.
 */
public class BrowserSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrowserSession.class);

    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final boolean headless;

    /**
     * @param browser owning browser, may be null when the context is not owned by this session
     */
    public BrowserSession(Browser browser, BrowserContext context, Page page, boolean headless) {
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.headless = headless;
    }

    public BrowserContext context() {
        return context;
    }

    public Page page() {
        return page;
    }

    public boolean headless() {
        return headless;
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        if (browser != null) {
            try {
                browser.close();
            } catch (Exception e) {
                logger.warn("Failed to close browser: {}", e.getMessage());
            }
        }
    }
}
