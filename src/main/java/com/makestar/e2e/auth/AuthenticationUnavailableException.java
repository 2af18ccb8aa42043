package com.makestar.e2e.auth;

/**
 * Raised by the gate when credentials are unusable and renewal did not recover them, or when another
 * worker has already recorded that authentication is broken.
 */
public class AuthenticationUnavailableException extends AuthenticationException {

    public AuthenticationUnavailableException(AuthFailureReason reason, String detail, String remediation) {
        super(reason, detail, remediation);
    }
}
