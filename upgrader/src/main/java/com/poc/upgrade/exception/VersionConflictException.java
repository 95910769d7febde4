package com.poc.upgrade.exception;

import lombok.Getter;

/**
 * Exception thrown when the stored schema version no longer matches the version
 * a runner started from, usually because another runner advanced it first.
 */
@Getter
public class VersionConflictException extends MigrationException {
    
    private final int expectedVersion;
    
    /**
     * Version found in the ledger, or null if the version record was missing.
     */
    private final Integer actualVersion;
    
    public VersionConflictException(int expectedVersion, Integer actualVersion) {
        super(String.format(
            "Schema version conflict: expected %d but found %s",
            expectedVersion,
            actualVersion == null ? "no version record" : actualVersion
        ));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
