package com.makestar.e2e.auth;

import java.util.Optional;

/**
 * Durable storage for everything the credential lifecycle shares across worker processes.
 * <p>
 * Implementations must treat unreadable or corrupt entries as absent and must replace entries as a whole,
 * so that concurrent writers leave exactly one complete write behind. No locking is implied; the last
 * writer wins.
 */
public interface CredentialRepository {

    /**
     * Loads the structured credential record.
     * @return the record, or empty when it is missing or unreadable
     */
    Optional<CredentialRecord> load();

    /**
     * Replaces the structured credential record.
     * @param record record to persist
     */
    void save(CredentialRecord record);

    /**
     * Loads the browser session snapshot captured for a site.
     * @param site site whose snapshot to read
     * @return the snapshot, or empty when it is missing or unreadable
     */
    Optional<SessionSnapshot> loadSnapshot(TargetSite site);

    /**
     * Replaces the browser session snapshot for a site.
     * @param site site the snapshot belongs to
     * @param snapshot snapshot to persist
     */
    void saveSnapshot(TargetSite site, SessionSnapshot snapshot);

    /**
     * Reads the raw failure flag, without applying any TTL.
     * @return the flag, or empty when none is recorded
     */
    Optional<FailureFlag> readFailureFlag();

    void writeFailureFlag(FailureFlag flag);

    void deleteFailureFlag();
}
