package com.makestar.e2e.auth.junit;

import com.makestar.e2e.auth.AuthenticationException;
import com.makestar.e2e.auth.BrowserSession;
import com.makestar.e2e.auth.NavigationGuard;
import com.makestar.e2e.auth.SessionKeeper;
import com.makestar.e2e.auth.TargetSite;
import com.microsoft.playwright.Page;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * JUnit 5 extension for browser tests that need a logged-in session.
 *
 * - BeforeAll: runs the auth gate for the class's {@link AuthenticatedSite} (renewing if needed); a
 *   failure aborts the class with the command that repairs the session
 * - BeforeEach: fails the test at once if any worker has flagged authentication as broken, otherwise
 *   opens a browser with the stored session injected
 * - AfterEach: closes the browser
 *
 * One {@link SessionKeeper} is shared across the whole run through the root context store and closed
 * when the root context closes. Tests receive {@link Page} and {@link NavigationGuard} by parameter.
 */
public class AuthenticatedSessionExtension implements BeforeAllCallback,
        BeforeEachCallback, AfterEachCallback, ParameterResolver {
    private static final Logger logger = LoggerFactory.getLogger(AuthenticatedSessionExtension.class);

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(AuthenticatedSessionExtension.class);
    private static final String KEEPER_KEY = "sessionKeeper";
    private static final String SESSION_KEY = "browserSession";

    private final Supplier<SessionKeeper> keeperFactory;

    public AuthenticatedSessionExtension() {
        this(SessionKeeper::fromEnvironment);
    }

    /**
     * For registration with {@code @RegisterExtension} around a custom keeper.
     */
    public AuthenticatedSessionExtension(Supplier<SessionKeeper> keeperFactory) {
        this.keeperFactory = keeperFactory;
    }

    /**
     * Closes the shared keeper when the root context closes.
     */
    private static class KeeperResource implements ExtensionContext.Store.CloseableResource {
        private final SessionKeeper keeper;

        KeeperResource(SessionKeeper keeper) {
            this.keeper = keeper;
        }

        @Override
        public void close() {
            keeper.close();
        }
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        TargetSite site = siteOf(context);
        try {
            keeper(context).gate().ensureAuthenticated(site);
        } catch (AuthenticationException e) {
            logger.error("{} authentication unavailable for {}: {}", site,
                context.getRequiredTestClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        TargetSite site = siteOf(context);
        SessionKeeper keeper = keeper(context);
        try {
            keeper.gate().checkFailureFlag(site);
        } catch (AuthenticationException e) {
            logger.error("{} authentication failed in another worker; skipping {}: {}", site,
                context.getDisplayName(), e.getMessage());
            throw e;
        }
        BrowserSession session = keeper.openAuthenticated(site);
        context.getStore(NAMESPACE).put(SESSION_KEY, session);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        BrowserSession session = context.getStore(NAMESPACE).remove(SESSION_KEY, BrowserSession.class);
        if (session != null) {
            session.close();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return type == Page.class || type == NavigationGuard.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        if (type == Page.class) {
            BrowserSession session = extensionContext.getStore(NAMESPACE).get(SESSION_KEY, BrowserSession.class);
            if (session == null) {
                throw new ParameterResolutionException("No browser session is open for this test");
            }
            return session.page();
        }
        if (type == NavigationGuard.class) {
            return keeper(extensionContext).navigationGuard(siteOf(extensionContext));
        }
        throw new ParameterResolutionException("Unsupported parameter type: " + type);
    }

    private SessionKeeper keeper(ExtensionContext context) {
        ExtensionContext.Store rootStore = context.getRoot().getStore(NAMESPACE);
        return rootStore.getOrComputeIfAbsent(KEEPER_KEY, key -> new KeeperResource(keeperFactory.get()),
            KeeperResource.class).keeper;
    }

    static TargetSite siteOf(ExtensionContext context) {
        return context.getTestClass()
            .map(c -> c.getAnnotation(AuthenticatedSite.class))
            .map(AuthenticatedSite::value)
            .orElse(TargetSite.ADMIN);
    }
}
