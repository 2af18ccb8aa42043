package com.makestar.e2e.auth;

/**
 * Opens browser instances for the renewal flows. The production implementation drives Playwright;
 * tests supply sessions built from mocked Playwright interfaces.
 */
@FunctionalInterface
public interface BrowserLauncher {

    /**
     * Launches a browser with a fresh, empty context.
     * @param headless true for a non-visible instance, false when a human must interact with it
     * @return the opened session; the caller closes it
     */
    BrowserSession open(boolean headless);
}
