package com.poc.upgrade.infrastructure.database;

import com.poc.upgrade.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inserts a row and returns its numeric id, allocated the dialect's way:
 * from a named sequence, or assigned by the database and read back.
 * Joins the caller's transaction; opens one otherwise so the read-back
 * happens on the inserting connection.
 */
@Component
@RequiredArgsConstructor
public class RowInserter {
    
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    
    public long insert(Dialect dialect, String table, String idColumn, String sequence, Map<String, Object> columns) {
        SqlValidator.validateIdentifier(table);
        SqlValidator.validateIdentifier(idColumn);
        columns.keySet().forEach(SqlValidator::validateIdentifier);
        
        Long id = transactionTemplate.execute(status -> {
            if (dialect.isSequenceIds()) {
                Long next = jdbcTemplate.queryForObject(dialect.nextValueQuery(sequence), Long.class);
                Map<String, Object> withId = new LinkedHashMap<>();
                withId.put(idColumn, next);
                withId.putAll(columns);
                executeInsert(table, withId);
                return next;
            }
            executeInsert(table, columns);
            return jdbcTemplate.queryForObject(dialect.lastInsertIdQuery(), Long.class);
        });
        
        if (id == null) {
            throw new IllegalStateException("No id allocated for insert into " + table);
        }
        return id;
    }
    
    private void executeInsert(String table, Map<String, Object> columns) {
        List<Object> values = new ArrayList<>(columns.values());
        String sql = "insert into " + table
            + " (" + String.join(", ", columns.keySet()) + ")"
            + " values (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        jdbcTemplate.update(sql, values.toArray());
    }
}
