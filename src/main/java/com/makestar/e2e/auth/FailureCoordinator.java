package com.makestar.e2e.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shares "authentication is broken" across worker processes so one worker's failure makes the others fail
 * fast instead of each retrying and timing out.
 * <p>
 * {@code Absent -> Failed} on {@link #markFailed}; {@code Failed -> Absent} on {@link #clear} or once the
 * flag is older than the TTL, whatever its {@code failed} field says. A stale flag is only ignored, never
 * deleted here, so a fresh flag another worker writes in the meantime cannot be lost.
 */
public class FailureCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(FailureCoordinator.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final CredentialRepository repository;
    private final Clock clock;
    private final Duration ttl;

    public FailureCoordinator(CredentialRepository repository, Clock clock) {
        this(repository, clock, DEFAULT_TTL);
    }

    public FailureCoordinator(CredentialRepository repository, Clock clock, Duration ttl) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * @return the live flag, or empty when none is recorded, it is not a failure, or it has outlived the TTL
     */
    public Optional<FailureFlag> isFailed() {
        Optional<FailureFlag> flag = repository.readFailureFlag();
        if (flag.isEmpty() || !flag.get().failed()) {
            return Optional.empty();
        }
        Instant expiresAt = flag.get().recordedAt().plus(ttl);
        if (!expiresAt.isAfter(clock.instant())) {
            logger.debug("Ignoring stale auth failure flag from {} ({})", flag.get().recordedAt(), flag.get().reason());
            return Optional.empty();
        }
        return flag;
    }

    public void markFailed(String reason) {
        FailureFlag flag = new FailureFlag(true, reason, clock.millis());
        repository.writeFailureFlag(flag);
        logger.warn("Recorded auth failure for all workers: {}", reason);
    }

    public void clear() {
        if (repository.readFailureFlag().isPresent()) {
            repository.deleteFailureFlag();
            logger.info("Cleared auth failure flag.");
        }
    }
}
