package com.makestar.e2e.auth;

/**
 * Delivery channel a refreshed token pair was found in, listed in the order they are checked.
 */
public enum HarvestSource {
    URL_QUERY,
    CLIENT_STORAGE,
    COOKIE
}
