package com.makestar.e2e.auth;

import java.util.Locale;

/**
 * How {@link AuthGate#renew} chooses between doing nothing, silent renewal and a human login.
 */
public enum RenewalMode {
    /** Interactive login regardless of current validity. */
    SETUP,
    /** Silent renewal, then interactive when silent fails, regardless of current validity. */
    FORCE,
    /** Nothing when valid, otherwise silent renewal only. Used by automated runs. */
    AUTO,
    /** Nothing when valid, otherwise silent renewal only. */
    IF_NEEDED;

    /**
     * Parses a CLI mode; {@code --setup} and {@code setup} are equivalent. Blank selects {@link #IF_NEEDED}.
     * @throws IllegalArgumentException for an unknown mode
     */
    public static RenewalMode fromArgument(String arg) {
        if (arg == null || arg.isBlank()) return IF_NEEDED;
        String normalized = arg.trim().toLowerCase(Locale.ROOT);
        while (normalized.startsWith("-")) normalized = normalized.substring(1);
        switch (normalized) {
            case "setup":
                return SETUP;
            case "force":
                return FORCE;
            case "auto":
                return AUTO;
            case "check":
            case "default":
                return IF_NEEDED;
            default:
                throw new IllegalArgumentException("Unknown mode: " + arg);
        }
    }
}
