package com.makestar.e2e.auth;

/**
 * Mid-test navigation kept bouncing to the login screen after every re-injection.
 */
public class AuthRedirectExhaustedException extends AuthenticationException {
    private final String finalUrl;

    public AuthRedirectExhaustedException(String finalUrl, String remediation) {
        super(AuthFailureReason.AUTH_REDIRECT_EXHAUSTED,
            "Redirected to the login page after all retries (" + finalUrl + ")", remediation);
        this.finalUrl = finalUrl;
    }

    public String finalUrl() {
        return finalUrl;
    }
}
