package com.makestar.e2e.auth;

import java.time.Clock;

/**
 * Wires the credential lifecycle together for one worker. Everything that touches disk, the clock or a
 * browser is passed in, so tests can assemble the same graph around a temp directory and mocked Playwright.
 */
public class SessionKeeper implements AutoCloseable {
    private final AuthSettings settings;
    private final Clock clock;
    private final BrowserLauncher launcher;
    private final CredentialRepository repository;
    private final SessionInjector injector;
    private final FailureCoordinator failureCoordinator;
    private final VerificationCache verificationCache;
    private final SilentRenewer silentRenewer;
    private final InteractiveRenewer interactiveRenewer;
    private final AuthGate gate;

    public SessionKeeper(AuthSettings settings, Clock clock, BrowserLauncher launcher) {
        this(settings, clock, launcher, new CredentialStore(settings.authDir()));
    }

    public SessionKeeper(AuthSettings settings, Clock clock, BrowserLauncher launcher, CredentialRepository repository) {
        this.settings = settings;
        this.clock = clock;
        this.launcher = launcher;
        this.repository = repository;
        this.injector = new SessionInjector();
        this.failureCoordinator = new FailureCoordinator(repository, clock);
        this.verificationCache = new VerificationCache(clock);
        SessionHarvester harvester = new SessionHarvester(repository, new SessionCapture(clock), new TokenHarvester(clock), clock);
        this.silentRenewer = new SilentRenewer(launcher, repository, injector, harvester, settings.navigationTimeoutMs());
        this.interactiveRenewer = new InteractiveRenewer(launcher, harvester, settings.interactiveWaitMs(), settings.navigationTimeoutMs());
        ExpiryEvaluator evaluator = new ExpiryEvaluator(clock, settings.proactiveBufferMs());
        this.gate = new AuthGate(settings, repository, evaluator, failureCoordinator, verificationCache,
            silentRenewer, interactiveRenewer);
    }

    /**
     * Production wiring: settings from the environment, system clock, Playwright chromium.
     */
    public static SessionKeeper fromEnvironment() {
        return new SessionKeeper(AuthSettings.fromEnvironment(), Clock.systemUTC(), new PlaywrightBrowserLauncher());
    }

    public AuthSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public BrowserLauncher launcher() {
        return launcher;
    }

    public CredentialRepository repository() {
        return repository;
    }

    public SessionInjector injector() {
        return injector;
    }

    public FailureCoordinator failureCoordinator() {
        return failureCoordinator;
    }

    public AuthGate gate() {
        return gate;
    }

    public SilentRenewer silentRenewer() {
        return silentRenewer;
    }

    public InteractiveRenewer interactiveRenewer() {
        return interactiveRenewer;
    }

    public NavigationGuard navigationGuard(TargetSite site) {
        return new NavigationGuard(site, repository, injector, failureCoordinator, verificationCache,
            settings.navigationTimeoutMs(), settings.navigationRetries());
    }

    /**
     * Opens a browser with the site's stored session already injected.
     */
    public BrowserSession openAuthenticated(TargetSite site) {
        BrowserSession session = launcher.open(!settings.headed());
        repository.loadSnapshot(site).ifPresent(snapshot -> injector.inject(session.context(), snapshot, site));
        return session;
    }

    @Override
    public void close() {
        if (launcher instanceof AutoCloseable) {
            try {
                ((AutoCloseable) launcher).close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close browser launcher: " + e.getMessage(), e);
            }
        }
    }
}
