package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runtime knobs for the credential lifecycle.
 * <p>
 * Every value is resolved from an environment variable first, then a JVM system property of the same
 * name, then the default. Target URLs are not part of this record; they are constants on {@link TargetSite}.
 *
 * @param authDir directory holding the credential, snapshot and failure-flag files
 * @param tokenBufferMs gating buffer subtracted from every expiry before it is compared with "now"
 * @param proactiveBufferMs larger buffer that only marks a credential as expiring soon
 * @param interactiveWaitMs how long a human gets to finish the visible login
 * @param navigationTimeoutMs per-attempt navigation timeout
 * @param navigationRetries redirect budget handed to {@link NavigationGuard} by default
 * @param headed run test browsers visibly
 * @param interactiveFallback whether the gate may open a visible browser when silent renewal fails
 */
public record AuthSettings(
    Path authDir,
    long tokenBufferMs,
    long proactiveBufferMs,
    long interactiveWaitMs,
    long navigationTimeoutMs,
    int navigationRetries,
    boolean headed,
    boolean interactiveFallback
) {
    private static final Logger logger = LoggerFactory.getLogger(AuthSettings.class);

    public static final long DEFAULT_TOKEN_BUFFER_MS = 60_000;
    public static final long DEFAULT_PROACTIVE_BUFFER_MS = 5 * 60_000;
    public static final long DEFAULT_INTERACTIVE_WAIT_MS = 3 * 60_000;
    public static final long DEFAULT_NAVIGATION_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_NAVIGATION_RETRIES = 2;

    /**
     * Settings with every default, rooted at the given directory. Used by tests and embedders.
     */
    public static AuthSettings defaults(Path authDir) {
        return new AuthSettings(authDir, DEFAULT_TOKEN_BUFFER_MS, DEFAULT_PROACTIVE_BUFFER_MS,
            DEFAULT_INTERACTIVE_WAIT_MS, DEFAULT_NAVIGATION_TIMEOUT_MS, DEFAULT_NAVIGATION_RETRIES, false, true);
    }

    public static AuthSettings fromEnvironment() {
        AuthSettings settings = new AuthSettings(
            Paths.get(envOrProp("SESSION_KEEPER_AUTH_DIR", ".")),
            longSetting("AUTH_TOKEN_BUFFER_MS", DEFAULT_TOKEN_BUFFER_MS),
            longSetting("AUTH_PROACTIVE_BUFFER_MS", DEFAULT_PROACTIVE_BUFFER_MS),
            longSetting("AUTH_INTERACTIVE_WAIT_MS", DEFAULT_INTERACTIVE_WAIT_MS),
            longSetting("AUTH_NAVIGATION_TIMEOUT_MS", DEFAULT_NAVIGATION_TIMEOUT_MS),
            (int) longSetting("AUTH_NAVIGATION_RETRIES", DEFAULT_NAVIGATION_RETRIES),
            Boolean.parseBoolean(envOrProp("HEADED", "false")),
            Boolean.parseBoolean(envOrProp("AUTH_INTERACTIVE_FALLBACK", "true"))
        );
        logger.debug("Resolved auth settings: {}", settings);
        return settings;
    }

    public AuthSettings withAuthDir(Path dir) {
        return new AuthSettings(dir, tokenBufferMs, proactiveBufferMs, interactiveWaitMs,
            navigationTimeoutMs, navigationRetries, headed, interactiveFallback);
    }

    public AuthSettings withInteractiveFallback(boolean enabled) {
        return new AuthSettings(authDir, tokenBufferMs, proactiveBufferMs, interactiveWaitMs,
            navigationTimeoutMs, navigationRetries, headed, enabled);
    }

    static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null && !ev.isBlank()) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment lookup for {} denied: {}", key, e.getMessage());
        }
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static long longSetting(String key, long defaultVal) {
        String raw = envOrProp(key, Long.toString(defaultVal));
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}='{}', using {}", key, raw, defaultVal);
            return defaultVal;
        }
    }
}
