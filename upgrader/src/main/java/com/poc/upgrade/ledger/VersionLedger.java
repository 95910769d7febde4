package com.poc.upgrade.ledger;

/**
 * Single source of truth for the database's current schema version.
 */
public interface VersionLedger {
    
    /**
     * Read the current version within the active transaction, if any.
     */
    int currentVersion();
    
    /**
     * Take the ledger row's write lock in the active transaction, then read the version.
     * Must be the first statement of a step transaction so that a concurrent runner
     * waits here and sees the committed version instead of racing through the DDL.
     */
    int lockCurrentVersion();
    
    /**
     * Compare-and-set the version from {@code expectedCurrent} to {@code newVersion}.
     *
     * @throws com.poc.upgrade.exception.VersionConflictException if the stored
     *         version is not {@code expectedCurrent} at write time
     */
    void advance(int expectedCurrent, int newVersion);
    
    /**
     * Whether the ledger table exists.
     */
    boolean exists();
    
    /**
     * Record the initial version of a freshly installed schema.
     */
    void initialize(int version);
}
