package com.makestar.e2e.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * File-backed {@link CredentialRepository}.
 * <p>
 * Layout inside the auth directory:
 * <ul>
 *   <li>{@code admin-tokens.json}: the credential record</li>
 *   <li>one snapshot file per site, named by {@link TargetSite#snapshotFileName()}</li>
 *   <li>{@code .auth-failed}: the failure flag</li>
 * </ul>
 * Every write goes to a temporary sibling file that is then moved over the target, so readers in other
 * processes see either the previous or the new content, never a partial write.
 *
 * @author Makestar QA Automation
 * @since 1.0
 */
public class CredentialStore implements CredentialRepository {
    private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);

    public static final String CREDENTIAL_FILE = "admin-tokens.json";
    public static final String FAILURE_FLAG_FILE = ".auth-failed";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path authDir;

    public CredentialStore(Path authDir) {
        this.authDir = authDir;
    }

    public Path authDir() {
        return authDir;
    }

    public Path credentialFile() {
        return authDir.resolve(CREDENTIAL_FILE);
    }

    public Path snapshotFile(TargetSite site) {
        return authDir.resolve(site.snapshotFileName());
    }

    public Path failureFlagFile() {
        return authDir.resolve(FAILURE_FLAG_FILE);
    }

    @Override
    public Optional<CredentialRecord> load() {
        return readJson(credentialFile(), CredentialFile.class).flatMap(CredentialFile::toRecord);
    }

    @Override
    public void save(CredentialRecord record) {
        writeJson(credentialFile(), CredentialFile.from(record));
        logger.info("Saved credential record to {} (expires {})", credentialFile(), record.expiresAt());
    }

    @Override
    public Optional<SessionSnapshot> loadSnapshot(TargetSite site) {
        return readJson(snapshotFile(site), SessionSnapshot.class);
    }

    @Override
    public void saveSnapshot(TargetSite site, SessionSnapshot snapshot) {
        SessionSnapshot normalized = new SessionSnapshot(snapshot.cookies(), snapshot.storageEntries(),
            truncate(snapshot.savedAt()));
        writeJson(snapshotFile(site), normalized);
        logger.info("Saved {} session snapshot to {} ({} cookies)", site, snapshotFile(site), snapshot.cookies().size());
    }

    @Override
    public Optional<FailureFlag> readFailureFlag() {
        return readJson(failureFlagFile(), FailureFlag.class);
    }

    @Override
    public void writeFailureFlag(FailureFlag flag) {
        writeJson(failureFlagFile(), flag);
    }

    @Override
    public void deleteFailureFlag() {
        try {
            Files.deleteIfExists(failureFlagFile());
        } catch (IOException e) {
            logger.warn("Failed to delete failure flag {}: {}", failureFlagFile(), e.getMessage());
        }
    }

    private <T> Optional<T> readJson(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            T value = MAPPER.readValue(Files.readAllBytes(file), type);
            return Optional.ofNullable(value);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeJson(Path file, Object value) {
        Path tmp = null;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            tmp = Files.createTempFile(file.toAbsolutePath().getParent(), file.getFileName().toString(), ".tmp");
            Files.write(tmp, MAPPER.writeValueAsBytes(value));
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.error("Failed to write {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write " + file, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    logger.debug("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * On-disk shape of the credential record, kept flat for compatibility with the suites that read it.
     * {@code userId} is best-effort: other writers may store any JSON value there, and anything that is not
     * a number reads as 0 rather than rejecting the file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CredentialFile(
        String accessToken,
        String refreshToken,
        String email,
        String userName,
        @JsonProperty("isAdmin") boolean admin,
        Instant expiresAt,
        JsonNode userId,
        Instant savedAt
    ) {
        static CredentialFile from(CredentialRecord record) {
            SubjectIdentity subject = record.subject();
            return new CredentialFile(record.accessToken(), record.refreshToken(), subject.email(),
                subject.displayName(), subject.privileged(), truncate(record.expiresAt()), LongNode.valueOf(record.userId()),
                truncate(record.savedAt()));
        }

        Optional<CredentialRecord> toRecord() {
            if (expiresAt == null) {
                logger.warn("Credential file has no expiresAt; treating it as absent.");
                return Optional.empty();
            }
            return Optional.of(new CredentialRecord(accessToken, refreshToken,
                new SubjectIdentity(email, userName, admin), userIdOrZero(), expiresAt, savedAt,
                CredentialQuality.assess(accessToken, refreshToken)));
        }

        private long userIdOrZero() {
            if (userId == null || !userId.isValueNode()) return 0;
            return userId.asLong(0);
        }
    }
}
