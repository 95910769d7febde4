package com.poc.upgrade.util;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Utility class for retrying operations that fail with a specific, recoverable exception.
 */
@Slf4j
public class RetryUtil {
    
    private RetryUtil() {
        // Utility class - prevent instantiation
    }
    
    /**
     * Execute operation, retrying only when it throws {@code retryOn}.
     * Any other exception propagates immediately. When every attempt fails the
     * last {@code retryOn} exception is rethrown.
     * 
     * @param operation The operation to execute
     * @param retryOn Exception type that triggers another attempt
     * @param maxAttempts Maximum number of attempts
     * @param delayMs Delay before the next attempt, multiplied by the attempt number
     * @param operationName Name of the operation for logging
     * @return Result of the operation
     */
    public static <T, E extends RuntimeException> T executeWithRetry(
            Supplier<T> operation,
            Class<E> retryOn,
            int maxAttempts,
            long delayMs,
            String operationName) {
        
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        
        for (int attempt = 1; ; attempt++) {
            try {
                log.debug("Attempting {}: attempt {}/{}", operationName, attempt, maxAttempts);
                return operation.get();
                
            } catch (RuntimeException e) {
                if (!retryOn.isInstance(e)) {
                    throw e;
                }
                
                if (attempt >= maxAttempts) {
                    log.error("All {} attempts failed for {}", maxAttempts, operationName);
                    throw e;
                }
                
                long currentDelay = delayMs * attempt; // Linear backoff
                log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                        attempt, maxAttempts, operationName, e.getMessage(), currentDelay);
                
                sleep(currentDelay, e);
            }
        }
    }
    
    private static void sleep(long delayMs, RuntimeException pending) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }
}
