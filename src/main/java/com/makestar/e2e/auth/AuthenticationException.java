package com.makestar.e2e.auth;

/**
 * Authentication could not be established. The message always ends with the command that repairs it.
 */
public class AuthenticationException extends RuntimeException {
    private final AuthFailureReason reason;
    private final String remediation;

    public AuthenticationException(AuthFailureReason reason, String detail, String remediation) {
        super(detail + System.lineSeparator() + "  Run: " + remediation);
        this.reason = reason;
        this.remediation = remediation;
    }

    public AuthFailureReason reason() {
        return reason;
    }

    public String remediation() {
        return remediation;
    }
}
