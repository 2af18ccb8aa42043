package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Command-line entry point for renewing end-to-end test credentials.
 * <pre>
 *   java -jar session-keeper.jar [setup|force|auto|check] [admin|makestar|albumbuddy]
 * </pre>
 * Exit codes: 0 usable credentials, 1 renewal failed, 2 usage error.
 *
 * @author Makestar QA Automation
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: java -jar session-keeper.jar [setup|force|auto|check] [admin|makestar|albumbuddy]";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code;
        try (SessionKeeper keeper = SessionKeeper.fromEnvironment()) {
            code = run(args, keeper, System.out);
        }
        System.exit(code);
    }

    static int run(String[] args, SessionKeeper keeper, PrintStream out) {
        RenewalMode mode;
        TargetSite site;
        try {
            mode = RenewalMode.fromArgument(args != null && args.length > 0 ? args[0] : null);
            site = TargetSite.fromName(args != null && args.length > 1 ? args[1] : null);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        AuthGate gate = keeper.gate();
        AuthStatus before = gate.status(site);
        out.println(before.describe());
        if (mode == RenewalMode.SETUP) {
            out.println("A browser window will open. Log in to " + site.name().toLowerCase(Locale.ROOT)
                + " within " + keeper.settings().interactiveWaitMs() / 1000 + "s.");
        }

        boolean ok;
        try {
            ok = gate.renew(site, mode);
        } catch (RuntimeException e) {
            logger.error("Renewal for {} failed: {}", site, e.getMessage());
            ok = false;
        }

        if (ok) {
            out.println(gate.status(site).describe());
            return EXIT_OK;
        }
        out.println(site + " credentials could not be renewed automatically.");
        out.println("  Run: " + site.setupCommand());
        return EXIT_FAILED;
    }
}
