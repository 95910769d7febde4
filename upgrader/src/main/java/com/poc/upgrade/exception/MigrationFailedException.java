package com.poc.upgrade.exception;

import lombok.Getter;

/**
 * Exception thrown when an upgrade step fails and its transaction is rolled back.
 * Steps committed before the failing one remain applied.
 */
@Getter
public class MigrationFailedException extends MigrationException {
    
    /**
     * Schema version the database is left at, i.e. the failing step's from-version.
     */
    private final int atVersion;
    
    public MigrationFailedException(int atVersion, String message, Throwable cause) {
        super(message, cause);
        this.atVersion = atVersion;
    }
    
    public MigrationFailedException(int atVersion, Throwable cause) {
        this(atVersion,
            "Upgrade from version " + atVersion + " failed: " + (cause == null ? "unknown error" : cause.getMessage()),
            cause);
    }
}
