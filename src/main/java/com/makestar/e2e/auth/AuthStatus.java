package com.makestar.e2e.auth;

import java.time.Duration;

/**
 * Point-in-time view of a site's stored authentication, for operator output.
 */
public record AuthStatus(TargetSite site, ExpiryStatus expiry, Duration remaining) {

    public boolean usable() {
        return expiry.isUsable();
    }

    public String describe() {
        return site + ": " + expiry + " (remaining: " + Utils.formatRemaining(remaining) + ")";
    }
}
