package com.makestar.e2e.auth;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class FailureCoordinatorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path authDir;

    private FailureCoordinator coordinatorAt(CredentialStore store, Instant now) {
        return new FailureCoordinator(store, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void testMarkFailedIsVisibleToOtherWorkers() {
        CredentialStore store = new CredentialStore(authDir);
        coordinatorAt(store, NOW).markFailed("AUTH_REDIRECT_EXHAUSTED: https://stage-auth.makeuni2026.com/login/");

        FailureFlag flag = coordinatorAt(new CredentialStore(authDir), NOW.plusSeconds(10)).isFailed().orElseThrow();
        assertTrue(flag.failed());
        assertTrue(flag.reason().startsWith("AUTH_REDIRECT_EXHAUSTED"));
        assertEquals(NOW, flag.recordedAt());
    }

    @Test
    void testFlagOlderThanOneHourIsAbsentEvenThoughFileSaysFailed() throws Exception {
        CredentialStore store = new CredentialStore(authDir);
        store.writeFailureFlag(new FailureFlag(true, "EXPIRED", NOW.minus(Duration.ofHours(1)).minusMillis(1).toEpochMilli()));
        String onDisk = Files.readString(store.failureFlagFile());
        assertTrue(onDisk.contains("\"failed\" : true"), onDisk);

        assertTrue(coordinatorAt(store, NOW).isFailed().isEmpty());
        assertTrue(Files.exists(store.failureFlagFile()));
    }

    @Test
    void testStaleFlagReadDoesNotRemoveFlagWrittenAfterIt() {
        CredentialStore store = new CredentialStore(authDir);
        store.writeFailureFlag(new FailureFlag(true, "EXPIRED", NOW.minus(Duration.ofHours(2)).toEpochMilli()));
        FailureCoordinator reader = coordinatorAt(store, NOW);
        assertTrue(reader.isFailed().isEmpty());

        coordinatorAt(store, NOW).markFailed("AUTH_REDIRECT_EXHAUSTED: fresh");
        reader.isFailed();

        FailureFlag flag = store.readFailureFlag().orElseThrow();
        assertEquals("AUTH_REDIRECT_EXHAUSTED: fresh", flag.reason());
        assertTrue(reader.isFailed().isPresent());
    }

    @Test
    void testFlagJustUnderOneHourIsStillLive() {
        CredentialStore store = new CredentialStore(authDir);
        store.writeFailureFlag(new FailureFlag(true, "EXPIRED", NOW.minus(Duration.ofMinutes(59)).toEpochMilli()));

        assertTrue(coordinatorAt(store, NOW).isFailed().isPresent());
    }

    @Test
    void testFlagWithFailedFalseIsAbsent() {
        CredentialStore store = new CredentialStore(authDir);
        store.writeFailureFlag(new FailureFlag(false, "recovered", NOW.toEpochMilli()));

        assertTrue(coordinatorAt(store, NOW).isFailed().isEmpty());
    }

    @Test
    void testClearRemovesFlag() {
        CredentialStore store = new CredentialStore(authDir);
        FailureCoordinator coordinator = coordinatorAt(store, NOW);
        coordinator.markFailed("EXPIRED");

        coordinator.clear();

        assertTrue(coordinator.isFailed().isEmpty());
        assertFalse(Files.exists(store.failureFlagFile()));
    }
}
