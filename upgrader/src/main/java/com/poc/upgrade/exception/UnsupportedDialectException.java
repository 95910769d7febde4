package com.poc.upgrade.exception;

/**
 * Exception thrown when the connected database is not one of the supported dialects.
 */
public class UnsupportedDialectException extends MigrationException {
    
    public UnsupportedDialectException(String message) {
        super(message);
    }
    
    public UnsupportedDialectException(String message, Throwable cause) {
        super(message, cause);
    }
}
