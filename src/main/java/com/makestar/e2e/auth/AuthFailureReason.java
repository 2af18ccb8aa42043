package com.makestar.e2e.auth;

/**
 * Why authentication is not available. Only the interactive timeout and the redirect loop need an operator;
 * the rest are recovered by renewal or by a conservative default.
 */
public enum AuthFailureReason {
    CREDENTIAL_MISSING("No stored credential or session snapshot"),
    EXPIRED("Stored credential is past its expiry buffer"),
    SILENT_RENEWAL_TIMEOUT("The identity provider asked for a real login during silent renewal"),
    INTERACTIVE_RENEWAL_TIMEOUT("Login was not completed in the browser within the wait budget"),
    MALFORMED_TOKEN("Token expiry claim could not be decoded"),
    AUTH_REDIRECT_EXHAUSTED("Navigation kept landing on the login screen");

    private final String description;

    AuthFailureReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Recovers the reason from failure-flag text written as {@code "<REASON>: <detail>"}.
     * Unrecognised text maps to {@link #CREDENTIAL_MISSING}.
     */
    public static AuthFailureReason fromFlagReason(String text) {
        if (text == null || text.isBlank()) return CREDENTIAL_MISSING;
        int colon = text.indexOf(':');
        String prefix = (colon < 0 ? text : text.substring(0, colon)).trim();
        for (AuthFailureReason reason : values()) {
            if (reason.name().equals(prefix)) return reason;
        }
        return CREDENTIAL_MISSING;
    }
}
