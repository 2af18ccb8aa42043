package com.makestar.e2e.auth;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A token pair lifted from the browser after a login, with whatever profile data came along with it.
 *
 * @param userInfo parsed {@code user_info} storage entry, or null
 * @param storageExpiresAt raw {@code token_expires_at} storage entry, or null
 */
public record HarvestedTokens(
    String accessToken,
    String refreshToken,
    HarvestSource source,
    JsonNode userInfo,
    String storageExpiresAt
) {}
