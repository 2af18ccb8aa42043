package com.makestar.e2e.auth;

import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the cookie jar and {@code localStorage} of a live browser into a {@link SessionSnapshot}.
 * Cookies outside the site's allowed domains are dropped before anything is persisted.
 */
public class SessionCapture {
    private static final Logger logger = LoggerFactory.getLogger(SessionCapture.class);

    static final String READ_STORAGE_SCRIPT = "() => Object.assign({}, window.localStorage)";

    private final Clock clock;

    public SessionCapture(Clock clock) {
        this.clock = clock;
    }

    public SessionSnapshot capture(BrowserSession session, TargetSite site) {
        List<Cookie> raw = session.context().cookies();
        List<SessionCookie> cookies = raw.stream()
            .filter(c -> site.allowsCookieDomain(c.domain))
            .map(SessionCapture::toSessionCookie)
            .collect(Collectors.toList());
        if (cookies.size() < raw.size()) {
            logger.debug("Dropped {} cookie(s) outside the {} domains", raw.size() - cookies.size(), site);
        }
        Map<String, String> storage = readStorage(session);
        logger.info("Captured {} session: {} cookie(s), {} storage entr(ies)", site, cookies.size(), storage.size());
        return new SessionSnapshot(cookies, storage, clock.instant());
    }

    /**
     * Whether the browser already holds the cookies that identify a live session on this site.
     */
    public boolean hasSessionCookies(BrowserSession session, TargetSite site) {
        List<Cookie> cookies = session.context().cookies();
        return cookies.stream()
            .filter(c -> site.allowsCookieDomain(c.domain))
            .filter(c -> c.value != null && !c.value.isEmpty())
            .anyMatch(c -> site.sessionCookieNames().isEmpty() || site.sessionCookieNames().contains(c.name));
    }

    private Map<String, String> readStorage(BrowserSession session) {
        Object result = Utils.retryPlaywrightAction(() -> session.page().evaluate(READ_STORAGE_SCRIPT),
            3, "read localStorage", 250);
        Map<String, String> storage = new LinkedHashMap<>();
        if (result instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) result).entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    storage.put(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        } else if (result != null) {
            logger.warn("Unexpected localStorage result type: {}", result.getClass().getName());
        }
        return storage;
    }

    static SessionCookie toSessionCookie(Cookie c) {
        return new SessionCookie(c.name, c.value, c.domain, c.path, c.expires,
            Boolean.TRUE.equals(c.httpOnly), Boolean.TRUE.equals(c.secure), sameSiteName(c.sameSite));
    }

    private static String sameSiteName(SameSiteAttribute attribute) {
        if (attribute == null) return null;
        switch (attribute) {
            case STRICT:
                return "Strict";
            case NONE:
                return "None";
            default:
                return "Lax";
        }
    }
}
