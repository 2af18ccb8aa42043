package com.makestar.e2e.auth;

/**
 * Classification of stored credentials against the current time.
 */
public enum ExpiryStatus {
    VALID,
    /** Still usable for gating; only proactive renewal acts on it. */
    EXPIRING_SOON,
    EXPIRED,
    MISSING;

    public boolean isUsable() {
        return this == VALID || this == EXPIRING_SOON;
    }
}
