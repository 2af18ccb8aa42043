package com.makestar.e2e.auth;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * The web properties the suites authenticate against.
 * <p>
 * URLs are fixed here rather than read from configuration. Each site keeps its own session snapshot file;
 * only {@link #ADMIN} issues the JWT access/refresh pair that backs the structured credential record.
 */
public enum TargetSite {
    ADMIN(
        "https://stage-new-admin.makeuni2026.com",
        "stage-auth.makeuni2026.com",
        "/dashboard",
        "https://stage-auth.makeuni2026.com/login/?application=MAKESTAR&redirect_url=https://stage-new-admin.makeuni2026.com",
        "/auth/logout",
        "auth.json",
        List.of("stage-new-admin.makeuni2026.com", "stage-auth.makeuni2026.com", "makeuni2026.com"),
        List.of("sessionid", "refresh_token"),
        List.of("csrftoken", "sessionid", "refresh_token", "i18n_redirected"),
        "Google",
        true
    ),
    MAKESTAR(
        "https://www.makestar.com",
        "auth.makestar.com",
        "/my-page",
        "https://auth.makestar.com/login/?application=MAKESTAR&redirect_url=https://www.makestar.com/my-page",
        null,
        "makestar-auth.json",
        List.of("www.makestar.com", "auth.makestar.com", "makestar.com"),
        List.of(),
        List.of(),
        "Google",
        false
    ),
    ALBUMBUDDY(
        "https://albumbuddy.kr",
        "albumbuddy.kr",
        "/dashboard/purchasing",
        "https://albumbuddy.kr/shop",
        null,
        "ab-auth.json",
        List.of("albumbuddy.kr"),
        List.of(),
        List.of(),
        null,
        false
    );

    private final String baseUrl;
    private final String identityHost;
    private final String protectedPath;
    private final String loginEntryUrl;
    private final String logoutPath;
    private final String snapshotFileName;
    private final List<String> allowedDomains;
    private final List<String> sessionCookieNames;
    private final List<String> replayedCookieNames;
    private final String federatedButtonText;
    private final boolean issuesTokens;

    TargetSite(String baseUrl, String identityHost, String protectedPath, String loginEntryUrl, String logoutPath,
               String snapshotFileName, List<String> allowedDomains, List<String> sessionCookieNames,
               List<String> replayedCookieNames, String federatedButtonText, boolean issuesTokens) {
        this.baseUrl = baseUrl;
        this.identityHost = identityHost;
        this.protectedPath = protectedPath;
        this.loginEntryUrl = loginEntryUrl;
        this.logoutPath = logoutPath;
        this.snapshotFileName = snapshotFileName;
        this.allowedDomains = allowedDomains;
        this.sessionCookieNames = sessionCookieNames;
        this.replayedCookieNames = replayedCookieNames;
        this.federatedButtonText = federatedButtonText;
        this.issuesTokens = issuesTokens;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String baseHost() {
        return hostOf(baseUrl);
    }

    public String identityHost() {
        return identityHost;
    }

    public String protectedEntryUrl() {
        return baseUrl + protectedPath;
    }

    public String loginEntryUrl() {
        return loginEntryUrl;
    }

    /** Absolute logout URL, or null when the site exposes none. */
    public String logoutUrl() {
        return logoutPath == null ? null : baseUrl + logoutPath;
    }

    public String snapshotFileName() {
        return snapshotFileName;
    }

    public List<String> allowedDomains() {
        return allowedDomains;
    }

    /** Cookie names that identify a live session; empty means any cookie on an allowed domain counts. */
    public List<String> sessionCookieNames() {
        return sessionCookieNames;
    }

    /**
     * True when a cookie with this name may be replayed into a browser. An empty whitelist admits every name;
     * the admin console only gets its auth and locale cookies back.
     */
    public boolean replaysCookie(String name) {
        return replayedCookieNames.isEmpty() || replayedCookieNames.contains(name);
    }

    /** Visible label of the one-click identity-provider continuation, or null when the site has none. */
    public String federatedButtonText() {
        return federatedButtonText;
    }

    public String federatedButtonSelector() {
        return federatedButtonText == null ? null : "button:has-text(\"" + federatedButtonText + "\")";
    }

    public boolean issuesTokens() {
        return issuesTokens;
    }

    /** The CLI invocation an operator runs to repair this site's session by hand. */
    public String setupCommand() {
        return "java -jar session-keeper.jar setup " + name().toLowerCase(Locale.ROOT);
    }

    /**
     * Cookie scoping rule: the cookie domain (leading dot ignored) must equal an allowed domain or be a
     * subdomain of one.
     */
    public boolean allowsCookieDomain(String cookieDomain) {
        if (cookieDomain == null || cookieDomain.isBlank()) return false;
        String domain = cookieDomain.trim().toLowerCase(Locale.ROOT);
        if (domain.startsWith(".")) domain = domain.substring(1);
        for (String allowed : allowedDomains) {
            if (domain.equals(allowed) || domain.endsWith("." + allowed)) return true;
        }
        return false;
    }

    /** True when the URL is a login or identity-provider screen rather than protected content. */
    public boolean isLoginUrl(String url) {
        if (url == null || url.isBlank()) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        String path = pathOf(lower);
        if (path.contains("/login") || path.contains("/auth")) return true;
        String host = hostOf(lower);
        return host != null && !identityHost.equals(baseHost()) && host.equals(identityHost);
    }

    /** True when the URL sits on this site's protected origin and is not a login screen. */
    public boolean isOnProtectedOrigin(String url) {
        String host = hostOf(url);
        return host != null && host.equalsIgnoreCase(baseHost()) && !isLoginUrl(url);
    }

    static String hostOf(String url) {
        if (url == null) return null;
        try {
            return URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String pathOf(String url) {
        try {
            String path = URI.create(url.trim()).getRawPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    public static TargetSite fromName(String name) {
        if (name == null || name.isBlank()) return ADMIN;
        return TargetSite.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
