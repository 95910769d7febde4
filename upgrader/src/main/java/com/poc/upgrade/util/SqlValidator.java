package com.poc.upgrade.util;

/**
 * Utility class for validating SQL fragments taken from step definitions.
 */
public class SqlValidator {
    
    private SqlValidator() {
        // Utility class - prevent instantiation
    }
    
    /**
     * Validates a table or column name.
     * Allows: letters, numbers and underscores, starting with a letter or underscore.
     */
    public static boolean isValidIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        
        return identifier.matches("^[A-Za-z_][A-Za-z0-9_]*$");
    }
    
    /**
     * Validates a row selection predicate. Null means "all rows".
     * Statement separators and comments are rejected.
     */
    public static boolean isValidPredicate(String predicate) {
        if (predicate == null) {
            return true;
        }
        if (predicate.isBlank()) {
            return false;
        }
        
        return !predicate.contains(";") && !predicate.contains("--") && !predicate.contains("/*");
    }
    
    /**
     * Throws exception if identifier is invalid.
     */
    public static void validateIdentifier(String identifier) {
        if (!isValidIdentifier(identifier)) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
    }
    
    /**
     * Throws exception if predicate is invalid.
     */
    public static void validatePredicate(String predicate) {
        if (!isValidPredicate(predicate)) {
            throw new IllegalArgumentException("Invalid selection predicate: " + predicate);
        }
    }
}
