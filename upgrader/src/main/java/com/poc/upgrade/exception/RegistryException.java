package com.poc.upgrade.exception;

/**
 * Exception thrown when the packaged upgrade steps do not form a valid linear chain.
 * Always a packaging defect; never corrected automatically.
 */
public class RegistryException extends MigrationException {
    
    public RegistryException(String message) {
        super(message);
    }
    
    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
