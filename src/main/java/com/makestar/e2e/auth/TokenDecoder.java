package com.makestar.e2e.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads claims out of JWT-encoded provider tokens. Signatures are not verified; the claims are only used to
 * decide when to renew.
 */
public final class TokenDecoder {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TokenDecoder() {}

    /**
     * Decodes the payload segment of a JWT.
     * @param token compact JWT
     * @return payload claims as a JSON object
     * @throws MalformedTokenException if the token is not three dot-separated segments with a JSON payload
     */
    public static JsonNode decodeClaims(String token) throws MalformedTokenException {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("token is empty");
        }
        String[] parts = token.trim().split("\\.");
        if (parts.length < 2) {
            throw new MalformedTokenException("token is not a JWT (" + parts.length + " segment(s))");
        }
        String segment = parts[1].replace('+', '-').replace('/', '_');
        int pad = segment.indexOf('=');
        if (pad >= 0) segment = segment.substring(0, pad);
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment);
            JsonNode claims = MAPPER.readTree(new String(json, StandardCharsets.UTF_8));
            if (claims == null || !claims.isObject()) {
                throw new MalformedTokenException("token payload is not a JSON object");
            }
            return claims;
        } catch (IllegalArgumentException | IOException e) {
            throw new MalformedTokenException("token payload could not be decoded: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the {@code exp} claim (epoch seconds).
     * @throws MalformedTokenException if the claim is missing or not numeric
     */
    public static Instant decodeExpiry(String token) throws MalformedTokenException {
        JsonNode exp = decodeClaims(token).get("exp");
        if (exp == null || !exp.isNumber()) {
            throw new MalformedTokenException("token has no numeric exp claim");
        }
        return Instant.ofEpochMilli(Math.round(exp.asDouble() * 1000));
    }

    public static Optional<Instant> tryDecodeExpiry(String token) {
        try {
            return Optional.of(decodeExpiry(token));
        } catch (MalformedTokenException e) {
            return Optional.empty();
        }
    }
}
