package com.poc.upgrade.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses across the application.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    /**
     * Handle version conflicts: another process is upgrading the same database.
     */
    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<Map<String, Object>> handleVersionConflictException(
            VersionConflictException ex) {
        
        log.warn("Version conflict: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "Schema Version Conflict",
            ex.getMessage()
        );
    }
    
    /**
     * Handle failed upgrade steps.
     */
    @ExceptionHandler(MigrationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleMigrationFailedException(
            MigrationFailedException ex) {
        
        log.error("Upgrade failed at version {}: {}", ex.getAtVersion(), ex.getMessage(), ex);
        ResponseEntity<Map<String, Object>> response = buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "Schema Upgrade Failed",
            ex.getMessage()
        );
        response.getBody().put("atVersion", ex.getAtVersion());
        return response;
    }
    
    /**
     * Handle invalid upgrade step packaging.
     */
    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistryException(
            RegistryException ex) {
        
        log.error("Upgrade registry error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "Upgrade Registry Error",
            ex.getMessage()
        );
    }
    
    /**
     * Handle unsupported databases.
     */
    @ExceptionHandler(UnsupportedDialectException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedDialectException(
            UnsupportedDialectException ex) {
        
        log.error("Unsupported dialect: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "Unsupported Database",
            ex.getMessage()
        );
    }
    
    /**
     * Handle connection exceptions.
     */
    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleConnectionException(
            ConnectionException ex) {
        
        log.error("Connection error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Database Connection Error",
            ex.getMessage()
        );
    }
    
    /**
     * Handle generic migration exceptions.
     */
    @ExceptionHandler(MigrationException.class)
    public ResponseEntity<Map<String, Object>> handleMigrationException(
            MigrationException ex) {
        
        log.error("Migration error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "Migration Error",
            ex.getMessage()
        );
    }
    
    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex) {
        
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "Internal Server Error",
            "An unexpected error occurred. Please check logs for details."
        );
    }
    
    /**
     * Build standardized error response.
     */
    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String error, String message) {
        
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        
        return ResponseEntity.status(status).body(body);
    }
}
