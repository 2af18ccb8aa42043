package com.makestar.e2e.auth;

/**
 * A strategy for obtaining fresh credentials for a site. The gate composes renewers in order and stops
 * at the first success.
 */
public interface Renewer {

    /**
     * Short name used in log output and operator messages.
     */
    String name();

    /**
     * Runs one renewal attempt. Failures are reported through the return value, never thrown.
     * @param site site to renew
     * @return true when fresh session material was captured and persisted
     */
    boolean attempt(TargetSite site);

    /**
     * State of the most recent attempt, {@link RenewalState#IDLE} before the first one.
     */
    RenewalState state();
}
