package com.makestar.e2e.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays a {@link SessionSnapshot} into a browser context: cookies through the context's cookie jar,
 * storage entries through an init script that only runs on the site's own host.
 * <p>
 * A cookie whose domain is not one of the site's allowed domains is never injected, nor is one whose name
 * the site does not replay.
 */
public class SessionInjector {
    private static final Logger logger = LoggerFactory.getLogger(SessionInjector.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @return number of cookies placed into the context
     */
    public int inject(BrowserContext context, SessionSnapshot snapshot, TargetSite site) {
        if (snapshot == null) {
            logger.debug("No {} snapshot to inject.", site);
            return 0;
        }
        List<Cookie> scoped = new ArrayList<>();
        int rejected = 0;
        for (SessionCookie cookie : snapshot.cookies()) {
            if (!site.allowsCookieDomain(cookie.domain())) {
                rejected++;
                continue;
            }
            if (!site.replaysCookie(cookie.name())) {
                logger.debug("Not replaying {} cookie {}", site, cookie.name());
                continue;
            }
            scoped.add(toPlaywrightCookie(cookie));
        }
        if (rejected > 0) {
            logger.warn("Skipped {} cookie(s) scoped outside {} domains {}", rejected, site, site.allowedDomains());
        }
        if (!scoped.isEmpty()) {
            context.addCookies(scoped);
        }
        if (!snapshot.storageEntries().isEmpty()) {
            context.addInitScript(storageScript(site, snapshot));
        }
        logger.info("Injected {} session: {} cookie(s), {} storage entr(ies)", site, scoped.size(),
            snapshot.storageEntries().size());
        return scoped.size();
    }

    static Cookie toPlaywrightCookie(SessionCookie cookie) {
        Cookie pc = new Cookie(cookie.name(), cookie.value() == null ? "" : cookie.value())
            .setDomain(cookie.domain())
            .setPath(cookie.path())
            .setHttpOnly(cookie.httpOnly())
            .setSecure(cookie.secure())
            .setSameSite(sameSite(cookie.sameSite()));
        if (cookie.expires() != null && cookie.expires() >= 0) {
            pc.setExpires(Math.floor(cookie.expires()));
        }
        return pc;
    }

    private static SameSiteAttribute sameSite(String value) {
        if ("Strict".equals(value)) return SameSiteAttribute.STRICT;
        if ("None".equals(value)) return SameSiteAttribute.NONE;
        return SameSiteAttribute.LAX;
    }

    static String storageScript(TargetSite site, SessionSnapshot snapshot) {
        try {
            return "(() => {\n"
                + "  if (window.location.hostname !== " + MAPPER.writeValueAsString(site.baseHost()) + ") return;\n"
                + "  const entries = " + MAPPER.writeValueAsString(snapshot.storageEntries()) + ";\n"
                + "  for (const [key, value] of Object.entries(entries)) {\n"
                + "    try { window.localStorage.setItem(key, value); } catch (e) { }\n"
                + "  }\n"
                + "})();";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Storage entries could not be serialized", e);
        }
    }
}
