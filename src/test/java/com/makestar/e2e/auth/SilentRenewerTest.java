package com.makestar.e2e.auth;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives the silent flow against mocked Playwright objects.
 */
public class SilentRenewerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String DASHBOARD = "https://stage-new-admin.makeuni2026.com/dashboard";
    private static final String LOGIN = "https://stage-auth.makeuni2026.com/login/?application=MAKESTAR";

    @TempDir
    Path authDir;

    private CredentialStore store;
    private BrowserLauncher launcher;
    private BrowserContext context;
    private Page page;
    private Locator googleButton;
    private SilentRenewer renewer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new CredentialStore(authDir);
        context = mock(BrowserContext.class);
        page = mock(Page.class);
        googleButton = mock(Locator.class);
        launcher = mock(BrowserLauncher.class);
        when(launcher.open(anyBoolean())).thenAnswer(inv -> new BrowserSession(null, context, page, inv.getArgument(0)));
        when(page.locator(anyString())).thenReturn(googleButton);
        when(googleButton.first()).thenReturn(googleButton);
        when(context.cookies()).thenReturn(List.of());
        when(page.evaluate(anyString())).thenReturn(Map.of());
        SessionHarvester harvester = new SessionHarvester(store, new SessionCapture(clock), new TokenHarvester(clock), clock);
        renewer = new SilentRenewer(launcher, store, new SessionInjector(), harvester, 30_000);
    }

    @Test
    void testLiveSessionIsHarvestedWithoutLogin() {
        Instant exp = NOW.plus(Duration.ofHours(3));
        when(page.url()).thenReturn(DASHBOARD + "?access_token=" + TestTokens.jwt(exp) + "&refresh_token=fresh-refresh");

        assertTrue(renewer.attempt(TargetSite.ADMIN));

        verify(launcher).open(true);
        verify(googleButton, never()).click();
        CredentialRecord saved = store.load().orElseThrow();
        assertEquals(exp, saved.expiresAt());
        assertEquals("fresh-refresh", saved.refreshToken());
        assertTrue(store.loadSnapshot(TargetSite.ADMIN).isPresent());
        assertEquals(RenewalState.SUCCEEDED, renewer.state());
        verify(context).close();
    }

    @Test
    void testOneClickContinuationIsFollowedBackToTheSite() {
        Instant exp = NOW.plus(Duration.ofHours(3));
        when(page.url()).thenReturn(LOGIN,
            DASHBOARD + "?access_token=" + TestTokens.jwt(exp) + "&refresh_token=fresh-refresh");

        assertTrue(renewer.attempt(TargetSite.ADMIN));

        verify(googleButton).click();
        assertEquals(exp, store.load().orElseThrow().expiresAt());
    }

    @Test
    void testCredentialFormFailsFastWithoutWaiting() {
        when(page.url()).thenReturn(LOGIN);
        doThrow(new PlaywrightException("Timeout 3000ms exceeded"))
            .when(googleButton).waitFor(any(Locator.WaitForOptions.class));

        long started = System.nanoTime();
        assertFalse(renewer.attempt(TargetSite.ADMIN));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(elapsedMs < 2_000, "took " + elapsedMs + "ms");
        verify(googleButton, never()).click();
        verify(page, never()).waitForTimeout(SilentRenewer.RETURN_POLL_INTERVAL_MS);
        assertTrue(store.load().isEmpty());
        assertEquals(RenewalState.FAILED, renewer.state());
    }

    @Test
    void testSiteWithoutOneClickLoginFailsFast() {
        when(page.url()).thenReturn("https://albumbuddy.kr/login");

        assertFalse(renewer.attempt(TargetSite.ALBUMBUDDY));
        verify(page, never()).locator(anyString());
    }

    @Test
    void testProviderThatNeverRedirectsBackIsBounded() {
        when(page.url()).thenReturn(LOGIN);

        assertFalse(renewer.attempt(TargetSite.ADMIN));

        verify(googleButton).click();
        verify(page, times(SilentRenewer.RETURN_POLL_ATTEMPTS - 1)).waitForTimeout(SilentRenewer.RETURN_POLL_INTERVAL_MS);
    }

    @Test
    void testOpaqueTokensAreSavedWithDefaultExpiry() {
        when(page.url()).thenReturn(DASHBOARD + "?access_token=opaque-access&refresh_token=opaque-refresh");

        assertTrue(renewer.attempt(TargetSite.ADMIN));

        CredentialRecord saved = store.load().orElseThrow();
        assertEquals(NOW.plus(CredentialRecord.DEFAULT_LIFETIME), saved.expiresAt());
        assertEquals(CredentialQuality.UNKNOWN, saved.quality());
    }

    @Test
    void testValidRefreshCookieAloneCountsAsRecovery() {
        String refreshJwt = TestTokens.jwt(NOW.plus(Duration.ofDays(14)));
        when(page.url()).thenReturn(DASHBOARD);
        when(context.cookies()).thenReturn(List.of(
            new Cookie("refresh_token", refreshJwt).setDomain(".makeuni2026.com").setPath("/")));

        assertTrue(renewer.attempt(TargetSite.ADMIN));

        assertTrue(store.load().isEmpty());
        assertEquals(refreshJwt, store.loadSnapshot(TargetSite.ADMIN).orElseThrow()
            .cookie("refresh_token").orElseThrow().value());
    }

    @Test
    void testStoredSessionAndRefreshTokenAreReplayed() {
        store.save(new CredentialRecord("old-access", "stored refresh", null, 1, NOW.minusSeconds(60), NOW, null));
        store.saveSnapshot(TargetSite.ADMIN, new SessionSnapshot(List.of(
            new SessionCookie("sessionid", "s1", "stage-new-admin.makeuni2026.com", "/", null, true, true, "Lax")),
            Map.of(), NOW));
        when(page.url()).thenReturn(LOGIN);
        doThrow(new PlaywrightException("Timeout")).when(googleButton).waitFor(any(Locator.WaitForOptions.class));

        renewer.attempt(TargetSite.ADMIN);

        verify(context).addCookies(anyList());
        verify(page).navigate(eq(DASHBOARD + "?refresh_token=stored+refresh"), any(Page.NavigateOptions.class));
    }

    @Test
    void testLaunchFailureIsReportedAsFalse() {
        when(launcher.open(anyBoolean())).thenThrow(new PlaywrightException("Executable doesn't exist"));

        assertFalse(renewer.attempt(TargetSite.ADMIN));
        assertEquals(RenewalState.FAILED, renewer.state());
    }

    @Test
    void testUnexpectedLandingPageFails() {
        when(page.url()).thenReturn("https://www.google.com/");

        assertFalse(renewer.attempt(TargetSite.ADMIN));
        verify(page, times(1)).waitForTimeout(anyDouble());
        verify(page, never()).locator(anyString());
    }
}
