package com.makestar.e2e.auth;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpiryEvaluatorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final long BUFFER_MS = 60_000;

    private final ExpiryEvaluator evaluator =
        new ExpiryEvaluator(Clock.fixed(NOW, ZoneOffset.UTC), AuthSettings.DEFAULT_PROACTIVE_BUFFER_MS);

    private static CredentialRecord record(Instant expiresAt) {
        String access = TestTokens.jwt(expiresAt);
        return new CredentialRecord(access, "refresh", null, 1, expiresAt, NOW, CredentialQuality.assess(access, "refresh"));
    }

    private static SessionSnapshot snapshotWithRefreshCookie(String value) {
        SessionCookie cookie = new SessionCookie("refresh_token", value, "stage-new-admin.makeuni2026.com", "/",
            null, true, true, "Lax");
        return new SessionSnapshot(List.of(cookie), Map.of(), NOW);
    }

    @Test
    void testTenMinutesLeftWithOneMinuteBufferIsValid() {
        assertEquals(ExpiryStatus.VALID, evaluator.classify(record(NOW.plus(Duration.ofMinutes(10))), BUFFER_MS));
    }

    @Test
    void testThirtySecondsLeftWithSixtySecondBufferIsExpired() {
        assertEquals(ExpiryStatus.EXPIRED, evaluator.classify(record(NOW.plusSeconds(30)), BUFFER_MS));
    }

    @Test
    void testBoundaryIsExpired() {
        assertEquals(ExpiryStatus.EXPIRED, evaluator.classify(record(NOW.plusMillis(BUFFER_MS)), BUFFER_MS));
        assertEquals(ExpiryStatus.EXPIRING_SOON, evaluator.classify(record(NOW.plusMillis(BUFFER_MS + 1)), BUFFER_MS));
    }

    @Test
    void testWithinProactiveBufferIsExpiringSoonButUsable() {
        ExpiryStatus status = evaluator.classify(record(NOW.plus(Duration.ofMinutes(4))), BUFFER_MS);
        assertEquals(ExpiryStatus.EXPIRING_SOON, status);
        assertTrue(status.isUsable());
    }

    @Test
    void testMissingRecordIsMissing() {
        assertEquals(ExpiryStatus.MISSING, evaluator.classify(null, BUFFER_MS));
    }

    @Test
    void testSyntheticRecordIsMissing() {
        CredentialRecord fake = new CredentialRecord("mock_token", "mock_token", null, 0,
            NOW.plus(Duration.ofDays(30)), NOW, CredentialQuality.SYNTHETIC);
        assertEquals(ExpiryStatus.MISSING, evaluator.classify(fake, BUFFER_MS));
    }

    @Test
    void testRefreshCookieRescuesMissingRecord() {
        SessionSnapshot snapshot = snapshotWithRefreshCookie(TestTokens.jwt(NOW.plus(Duration.ofHours(2))));
        assertEquals(ExpiryStatus.VALID, evaluator.classify(null, snapshot, BUFFER_MS));
    }

    @Test
    void testRefreshCookieRescuesExpiredRecord() {
        SessionSnapshot snapshot = snapshotWithRefreshCookie(TestTokens.jwt(NOW.plus(Duration.ofHours(2))));
        assertEquals(ExpiryStatus.VALID, evaluator.classify(record(NOW.minusSeconds(5)), snapshot, BUFFER_MS));
    }

    @Test
    void testUndecodableCookieNeverAssumesValidity() {
        SessionSnapshot snapshot = snapshotWithRefreshCookie("opaque-value");
        assertEquals(ExpiryStatus.MISSING, evaluator.classify(null, snapshot, BUFFER_MS));
        assertEquals(ExpiryStatus.EXPIRED, evaluator.classify(record(NOW.minusSeconds(5)), snapshot, BUFFER_MS));
    }

    @Test
    void testSnapshotClassificationUsesCookieAttributeExpiry() {
        double expires = NOW.plus(Duration.ofDays(7)).getEpochSecond();
        SessionCookie session = new SessionCookie("ab_session", "opaque", "albumbuddy.kr", "/", expires, true, true, "Lax");
        SessionCookie foreign = new SessionCookie("tracker", "x", "ads.example.com", "/", expires * 2, false, false, null);
        SessionSnapshot snapshot = new SessionSnapshot(List.of(session, foreign), Map.of(), NOW);

        assertEquals(ExpiryStatus.VALID, evaluator.classifySnapshot(snapshot, TargetSite.ALBUMBUDDY, BUFFER_MS));
        assertEquals(ExpiryStatus.MISSING, evaluator.classifySnapshot(null, TargetSite.ALBUMBUDDY, BUFFER_MS));
    }

    @Test
    void testRemainingPicksLongestSource() {
        SessionSnapshot snapshot = snapshotWithRefreshCookie(TestTokens.jwt(NOW.plus(Duration.ofHours(5))));
        Duration remaining = evaluator.remaining(record(NOW.plus(Duration.ofHours(2))), snapshot);
        assertEquals(Duration.ofHours(5), remaining);
        assertEquals("5h 0m", Utils.formatRemaining(remaining));
        assertEquals(Duration.ZERO, evaluator.remaining(null, null));
    }
}
