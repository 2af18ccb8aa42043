package com.makestar.e2e.auth.junit;

import com.makestar.e2e.auth.AuthSettings;
import com.makestar.e2e.auth.BrowserSession;
import com.makestar.e2e.auth.NavigationGuard;
import com.makestar.e2e.auth.SessionCookie;
import com.makestar.e2e.auth.SessionKeeper;
import com.makestar.e2e.auth.SessionSnapshot;
import com.makestar.e2e.auth.TargetSite;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Runs the extension for real around a keeper whose browser is mocked and whose AlbumBuddy session is
 * already valid on disk.
 */
@AuthenticatedSite(TargetSite.ALBUMBUDDY)
public class AuthenticatedSessionExtensionTest {
    private static final Path AUTH_DIR = createAuthDir();
    private static final BrowserContext CONTEXT = mock(BrowserContext.class);
    private static final Page PAGE = mock(Page.class);

    @RegisterExtension
    static final AuthenticatedSessionExtension EXTENSION = new AuthenticatedSessionExtension(() -> {
        SessionKeeper keeper = new SessionKeeper(AuthSettings.defaults(AUTH_DIR), Clock.systemUTC(),
            headless -> new BrowserSession(null, CONTEXT, PAGE, headless));
        keeper.repository().saveSnapshot(TargetSite.ALBUMBUDDY, new SessionSnapshot(List.of(
            new SessionCookie("ab_session", "s", "albumbuddy.kr", "/",
                (double) Instant.now().plus(Duration.ofDays(3)).getEpochSecond(), true, true, "Lax")),
            Map.of(), Instant.now()));
        return keeper;
    });

    private static Path createAuthDir() {
        try {
            return Files.createTempDirectory("session-keeper-ext");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @AfterAll
    static void cleanUp() throws IOException {
        try (var files = Files.list(AUTH_DIR)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
        }
        Files.deleteIfExists(AUTH_DIR);
    }

    @Test
    void testPageHasStoredSessionInjected(Page page) {
        assertSame(PAGE, page);
        verify(CONTEXT, atLeastOnce()).addCookies(anyList());
    }

    @Test
    void testNavigationGuardTargetsAnnotatedSite(NavigationGuard guard) {
        assertEquals(TargetSite.ALBUMBUDDY, guard.site());
    }
}
