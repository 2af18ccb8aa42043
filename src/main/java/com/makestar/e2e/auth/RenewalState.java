package com.makestar.e2e.auth;

/**
 * Lifecycle of a single renewal attempt: {@code IDLE -> ATTEMPTING -> SUCCEEDED | FAILED}.
 */
public enum RenewalState {
    IDLE,
    ATTEMPTING,
    SUCCEEDED,
    FAILED
}
