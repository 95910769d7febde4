package com.poc.upgrade.exception;

/**
 * Exception thrown when recording or executing deferred backfill work fails.
 */
public class BackfillException extends MigrationException {
    
    public BackfillException(String message) {
        super(message);
    }
    
    public BackfillException(String message, Throwable cause) {
        super(message, cause);
    }
}
