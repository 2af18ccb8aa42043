package com.makestar.e2e.auth;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class UtilsTest {

    @Test
    void testRetryPlaywrightActionSuccessAfterRetries() {
        final int[] attempts = {0};
        Callable<String> action = () -> {
            if (attempts[0] < 2) {
                attempts[0]++;
                throw new IOException("Simulated failure");
            }
            return "Success";
        };
        String result = Utils.retryPlaywrightAction(action, 3, "test action", 1);
        assertEquals("Success", result);
        assertEquals(2, attempts[0]);
    }

    @Test
    void testRetryPlaywrightActionFailure() {
        Integer result = Utils.retryPlaywrightAction(() -> { throw new RuntimeException("fail"); }, 2, "fail action", 1);
        assertNull(result);
    }

    @Test
    void testPollUntilStopsAtFirstSuccess() {
        Page page = mock(Page.class);
        AtomicInteger calls = new AtomicInteger();

        assertTrue(Utils.pollUntil(page, () -> calls.incrementAndGet() == 3, 10, 500, "third call"));
        assertEquals(3, calls.get());
        verify(page, times(2)).waitForTimeout(500);
    }

    @Test
    void testPollUntilIsBounded() {
        Page page = mock(Page.class);
        AtomicInteger calls = new AtomicInteger();

        assertFalse(Utils.pollUntil(page, () -> {
            calls.incrementAndGet();
            throw new PlaywrightException("Target closed");
        }, 4, 250, "never"));
        assertEquals(4, calls.get());
        verify(page, times(3)).waitForTimeout(250);
    }

    @Test
    void testIsVisibleWithinTreatsTimeoutAsHidden() {
        Locator locator = mock(Locator.class);
        when(locator.first()).thenReturn(locator);
        doThrow(new PlaywrightException("Timeout 3000ms exceeded")).when(locator).waitFor(any(Locator.WaitForOptions.class));

        assertFalse(Utils.isVisibleWithin(locator, 3000));
        assertFalse(Utils.isVisibleWithin(null, 3000));
    }

    @Test
    void testFormatRemaining() {
        assertEquals("2h 13m", Utils.formatRemaining(Duration.ofMinutes(133)));
        assertEquals("0h 0m", Utils.formatRemaining(Duration.ofSeconds(-5)));
    }
}
