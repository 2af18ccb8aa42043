package com.makestar.e2e.auth;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * Bounded waiting and retry helpers shared by the renewal and navigation flows.
 *
 * @author Makestar QA Automation
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Evaluates a condition up to {@code maxAttempts} times, pausing {@code intervalMs} on the page between
     * attempts. Exceptions from the condition count as "not yet".
     * @param page page whose clock is used for the pause
     * @param condition condition to wait for
     * @param maxAttempts upper bound on evaluations, at least one
     * @param intervalMs pause between evaluations
     * @param description used in log output
     * @return true as soon as the condition holds, false when the attempts run out
     */
    public static boolean pollUntil(Page page, BooleanSupplier condition, int maxAttempts, long intervalMs, String description) {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (condition.getAsBoolean()) {
                    logger.debug("{} satisfied after {} attempt(s)", description, attempt);
                    return true;
                }
            } catch (PlaywrightException e) {
                logger.debug("{} check failed (attempt {}): {}", description, attempt, e.getMessage());
            }
            if (attempt < attempts) {
                page.waitForTimeout(intervalMs);
            }
        }
        logger.debug("{} not satisfied after {} attempt(s)", description, attempts);
        return false;
    }

    /**
     * Waits up to {@code timeoutMs} for the locator's first match to become visible.
     */
    public static boolean isVisibleWithin(Locator locator, long timeoutMs) {
        if (locator == null) return false;
        try {
            locator.first().waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.VISIBLE)
                .setTimeout(timeoutMs));
            return true;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    /**
     * Retries a Playwright action up to maxRetries times with exponential backoff.
     * @param action Callable action to execute
     * @param maxRetries Maximum number of attempts
     * @param actionDesc Description for logging
     * @param baseBackoffMs delay before the second attempt; doubles after each failure
     * @param <T> Return type
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc, long baseBackoffMs) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts + 1, e.getMessage());
                attempts++;
                if (attempts < maxRetries) {
                    try {
                        Thread.sleep(baseBackoffMs * (1L << (attempts - 1)));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        logger.warn("Interrupted while retrying {}", actionDesc);
                        return null;
                    }
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }

    /**
     * Renders a remaining lifetime the way operators read it, e.g. {@code 2h 13m}.
     */
    public static String formatRemaining(Duration remaining) {
        if (remaining == null || remaining.isNegative() || remaining.isZero()) return "0h 0m";
        return remaining.toHours() + "h " + remaining.toMinutesPart() + "m";
    }
}
