package com.poc.upgrade.ledger;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.MigrationException;
import com.poc.upgrade.exception.VersionConflictException;
import com.poc.upgrade.util.SqlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ledger stored as the {@code VERSION} row of a two-column (NAME, VALUE) table.
 */
@Component
@Slf4j
public class JdbcVersionLedger implements VersionLedger {
    
    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final String versionKey;
    
    public JdbcVersionLedger(JdbcTemplate jdbcTemplate, UpgradeProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = properties.getLedger().getTable();
        this.versionKey = properties.getLedger().getVersionKey();
        SqlValidator.validateIdentifier(table);
    }
    
    @Override
    public int currentVersion() {
        Integer version = readVersion();
        if (version == null) {
            throw new MigrationException("Schema version record '" + versionKey + "' is missing from " + table);
        }
        return version;
    }
    
    @Override
    public int lockCurrentVersion() {
        // a self-assignment takes the row lock on every supported database,
        // and the RESERVED lock on SQLite
        int locked = jdbcTemplate.update(
            "update " + table + " set VALUE = VALUE where NAME = ?", versionKey
        );
        if (locked == 0) {
            throw new MigrationException("Schema version record '" + versionKey + "' is missing from " + table);
        }
        return currentVersion();
    }
    
    @Override
    public void advance(int expectedCurrent, int newVersion) {
        if (newVersion <= expectedCurrent) {
            throw new IllegalArgumentException(
                "Schema version must increase: " + expectedCurrent + " -> " + newVersion);
        }
        
        int updated = jdbcTemplate.update(
            "update " + table + " set VALUE = ? where NAME = ? and VALUE = ?",
            String.valueOf(newVersion), versionKey, String.valueOf(expectedCurrent)
        );
        
        if (updated != 1) {
            throw new VersionConflictException(expectedCurrent, readVersion());
        }
        log.debug("Schema version advanced {} -> {}", expectedCurrent, newVersion);
    }
    
    @Override
    public boolean exists() {
        try {
            jdbcTemplate.queryForList("select NAME from " + table + " where 1 = 0");
            return true;
        } catch (DataAccessException e) {
            log.debug("Ledger table {} is not readable: {}", table, e.getMessage());
            return false;
        }
    }
    
    @Override
    public void initialize(int version) {
        if (readVersion() != null) {
            throw new MigrationException("Schema version is already recorded in " + table);
        }
        jdbcTemplate.update(
            "insert into " + table + " (NAME, VALUE) values (?, ?)",
            versionKey, String.valueOf(version)
        );
        log.info("Schema version initialised at {}", version);
    }
    
    private Integer readVersion() {
        List<String> values = jdbcTemplate.queryForList(
            "select VALUE from " + table + " where NAME = ?", String.class, versionKey
        );
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new MigrationException("More than one '" + versionKey + "' record in " + table);
        }
        try {
            return Integer.valueOf(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new MigrationException("Schema version '" + values.get(0) + "' is not an integer", e);
        }
    }
}
