package com.poc.upgrade.infrastructure.database;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.ConnectionException;
import com.poc.upgrade.exception.UnsupportedDialectException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;

/**
 * Maps a live connection to one of the supported dialects.
 * The configured {@code upgrade.dialect} wins over detection when set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DialectResolver {
    
    private final DataSource dataSource;
    private final UpgradeProperties properties;
    
    private volatile Dialect current;
    
    /**
     * Resolve a dialect from connection metadata. Pure mapping, no side effects.
     */
    public Dialect resolve(ConnectionMetadata metadata) {
        Dialect dialect = Arrays.stream(Dialect.values())
            .filter(candidate -> candidate.matchesProduct(metadata.getProductName()))
            .findFirst()
            .orElseThrow(() -> new UnsupportedDialectException(
                "No dialect matches database product '" + metadata.getProductName() + "'"
            ));
        
        if (metadata.getMajorVersion() < dialect.getMinimumMajorVersion()) {
            throw new UnsupportedDialectException(String.format(
                "%s %s is not supported; version %d or later is required",
                metadata.getProductName(),
                metadata.getProductVersion(),
                dialect.getMinimumMajorVersion()
            ));
        }
        return dialect;
    }
    
    /**
     * Dialect of the application's data source, resolved once.
     */
    public Dialect current() {
        Dialect resolved = current;
        if (resolved == null) {
            synchronized (this) {
                if (current == null) {
                    current = resolveConfigured();
                }
                resolved = current;
            }
        }
        return resolved;
    }
    
    private Dialect resolveConfigured() {
        String configured = properties.getDialect();
        if (StringUtils.isNotBlank(configured)) {
            try {
                Dialect dialect = Dialect.fromString(configured);
                log.info("Using configured dialect: {}", dialect.getTypeName());
                return dialect;
            } catch (IllegalArgumentException e) {
                throw new UnsupportedDialectException(e.getMessage(), e);
            }
        }
        
        try (Connection conn = dataSource.getConnection()) {
            ConnectionMetadata metadata = ConnectionMetadata.from(conn.getMetaData());
            Dialect dialect = resolve(metadata);
            log.info("Detected dialect {} ({} {}) at {}",
                dialect.getTypeName(), metadata.getProductName(), metadata.getProductVersion(), metadata.getUrl());
            return dialect;
        } catch (SQLException e) {
            throw new ConnectionException("Failed to read database metadata", e);
        }
    }
}
