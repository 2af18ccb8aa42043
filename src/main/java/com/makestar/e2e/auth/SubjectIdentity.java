package com.makestar.e2e.auth;

/**
 * Best-effort description of the principal behind a credential.
 */
public record SubjectIdentity(String email, String displayName, boolean privileged) {
    public static final String UNKNOWN_VALUE = "unknown";

    public SubjectIdentity {
        email = email == null || email.isBlank() ? UNKNOWN_VALUE : email;
        displayName = displayName == null || displayName.isBlank() ? UNKNOWN_VALUE : displayName;
    }

    public static SubjectIdentity unknown() {
        return new SubjectIdentity(UNKNOWN_VALUE, UNKNOWN_VALUE, false);
    }
}
