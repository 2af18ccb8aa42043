package com.makestar.e2e.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Finds refreshed provider tokens after a federated login.
 * <p>
 * The provider is inconsistent about where it surfaces tokens, so three channels are checked in order:
 * the URL query of the landing page, client-side storage, then cookies. A channel later in the order only
 * fills in what earlier channels left empty.
 */
public class TokenHarvester {
    private static final Logger logger = LoggerFactory.getLogger(TokenHarvester.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String USER_INFO = "user_info";
    static final String TOKEN_EXPIRES_AT = "token_expires_at";

    private final Clock clock;

    public TokenHarvester(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param currentUrl URL the browser landed on
     * @param snapshot cookies and storage captured from the same browser, may be null
     * @return the token pair, or empty when no channel provides both tokens
     */
    public Optional<HarvestedTokens> harvest(String currentUrl, SessionSnapshot snapshot) {
        Map<String, String> query = queryParameters(currentUrl);
        String access = blankToNull(query.get(ACCESS_TOKEN));
        String refresh = blankToNull(query.get(REFRESH_TOKEN));
        HarvestSource source = HarvestSource.URL_QUERY;

        Map<String, String> storage = snapshot == null ? Map.of() : snapshot.storageEntries();
        JsonNode userInfo = parseUserInfo(storage.get(USER_INFO));
        String storageExpiry = blankToNull(storage.get(TOKEN_EXPIRES_AT));

        if (access == null || refresh == null) {
            source = HarvestSource.CLIENT_STORAGE;
            if (access == null) access = blankToNull(storage.get(ACCESS_TOKEN));
            if (refresh == null) refresh = blankToNull(storage.get(REFRESH_TOKEN));
        }
        if ((access == null || refresh == null) && snapshot != null) {
            source = HarvestSource.COOKIE;
            String cookieAccess = snapshot.cookie(ACCESS_TOKEN).map(SessionCookie::value).map(TokenHarvester::blankToNull).orElse(null);
            String cookieRefresh = snapshot.cookie(REFRESH_TOKEN).map(SessionCookie::value).map(TokenHarvester::blankToNull).orElse(null);
            if (cookieAccess != null && cookieRefresh != null) {
                access = cookieAccess;
                refresh = cookieRefresh;
            }
        }
        if (access == null || refresh == null) {
            logger.info("No token pair found in URL, client storage or cookies.");
            return Optional.empty();
        }
        logger.info("Harvested token pair from {}", source);
        return Optional.of(new HarvestedTokens(access, refresh, source, userInfo, storageExpiry));
    }

    /**
     * Builds the record to persist. An undecodable access token does not fail the harvest: the storage
     * expiry or, failing that, {@link CredentialRecord#DEFAULT_LIFETIME} is used and the record is graded
     * {@link CredentialQuality#UNKNOWN}.
     */
    public CredentialRecord toCredential(HarvestedTokens tokens) {
        Instant now = clock.instant();
        Instant expiresAt;
        JsonNode claims = null;
        try {
            claims = TokenDecoder.decodeClaims(tokens.accessToken());
            expiresAt = TokenDecoder.decodeExpiry(tokens.accessToken());
        } catch (MalformedTokenException e) {
            logger.warn("Access token expiry unreadable ({}); using a conservative default.", e.getMessage());
            expiresAt = parseStorageExpiry(tokens.storageExpiresAt())
                .orElse(now.plus(CredentialRecord.DEFAULT_LIFETIME));
        }
        return new CredentialRecord(tokens.accessToken(), tokens.refreshToken(), subjectOf(tokens.userInfo(), claims),
            userIdOf(tokens.userInfo(), claims), expiresAt, now,
            CredentialQuality.assess(tokens.accessToken(), tokens.refreshToken()));
    }

    static SubjectIdentity subjectOf(JsonNode userInfo, JsonNode claims) {
        if (userInfo != null && userInfo.isObject()) {
            String name = text(userInfo, "userName");
            if (name == null) name = text(userInfo, "name");
            return new SubjectIdentity(text(userInfo, "email"), name, userInfo.path("isAdmin").asBoolean(false));
        }
        if (claims != null) {
            JsonNode info = claims.path("info");
            return new SubjectIdentity(text(info, "nickname"), text(info, "name"), claims.path("is_admin").asBoolean(false));
        }
        return SubjectIdentity.unknown();
    }

    static long userIdOf(JsonNode userInfo, JsonNode claims) {
        if (userInfo != null && userInfo.hasNonNull("userId")) return userInfo.path("userId").asLong(0);
        if (claims != null) return claims.path("user_id").asLong(0);
        return 0;
    }

    private static Optional<Instant> parseStorageExpiry(String raw) {
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(Instant.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(raw.trim())));
            } catch (NumberFormatException nfe) {
                logger.debug("Unparseable {} value '{}'", TOKEN_EXPIRES_AT, raw);
                return Optional.empty();
            }
        }
    }

    private static JsonNode parseUserInfo(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            logger.debug("Ignoring malformed {} entry: {}", USER_INFO, e.getMessage());
            return null;
        }
    }

    static Map<String, String> queryParameters(String url) {
        Map<String, String> params = new HashMap<>();
        if (url == null) return params;
        String query;
        try {
            query = URI.create(url.trim()).getRawQuery();
        } catch (IllegalArgumentException e) {
            int idx = url.indexOf('?');
            query = idx >= 0 ? url.substring(idx + 1) : null;
        }
        if (query == null || query.isEmpty()) return params;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
