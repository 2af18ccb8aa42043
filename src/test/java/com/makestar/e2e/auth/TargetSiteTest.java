package com.makestar.e2e.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TargetSiteTest {

    @Test
    void testCookieDomainScoping() {
        assertTrue(TargetSite.ADMIN.allowsCookieDomain(".makeuni2026.com"));
        assertTrue(TargetSite.ADMIN.allowsCookieDomain("stage-auth.makeuni2026.com"));
        assertFalse(TargetSite.ADMIN.allowsCookieDomain("makeuni2026.com.evil.io"));
        assertFalse(TargetSite.ADMIN.allowsCookieDomain("notmakeuni2026.com"));
        assertFalse(TargetSite.ALBUMBUDDY.allowsCookieDomain("www.makestar.com"));
        assertFalse(TargetSite.MAKESTAR.allowsCookieDomain(null));
    }

    @Test
    void testLoginDetection() {
        assertTrue(TargetSite.ADMIN.isLoginUrl("https://stage-auth.makeuni2026.com/login/?application=MAKESTAR"));
        assertTrue(TargetSite.ADMIN.isLoginUrl("https://stage-auth.makeuni2026.com/"));
        assertTrue(TargetSite.ALBUMBUDDY.isLoginUrl("https://albumbuddy.kr/auth/sign-in"));
        assertFalse(TargetSite.ADMIN.isLoginUrl("https://stage-new-admin.makeuni2026.com/dashboard"));
        assertFalse(TargetSite.ALBUMBUDDY.isLoginUrl("https://albumbuddy.kr/dashboard/purchasing"));
    }

    @Test
    void testProtectedOrigin() {
        assertTrue(TargetSite.ADMIN.isOnProtectedOrigin("https://stage-new-admin.makeuni2026.com/dashboard?x=1"));
        assertFalse(TargetSite.ADMIN.isOnProtectedOrigin("https://stage-auth.makeuni2026.com/login/"));
        assertFalse(TargetSite.ADMIN.isOnProtectedOrigin("about:blank"));
    }

    @Test
    void testFromName() {
        assertEquals(TargetSite.ADMIN, TargetSite.fromName(null));
        assertEquals(TargetSite.ALBUMBUDDY, TargetSite.fromName(" albumbuddy "));
        assertThrows(IllegalArgumentException.class, () -> TargetSite.fromName("shop"));
    }

    @Test
    void testSetupCommandNamesTheSite() {
        assertEquals("java -jar session-keeper.jar setup makestar", TargetSite.MAKESTAR.setupCommand());
    }
}
