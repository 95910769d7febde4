package com.poc.upgrade.backfill;

import com.poc.upgrade.util.SqlValidator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Raises the DATAVERSION column of a resource row to the target data version.
 * Rows already at or above the target are left alone.
 */
@Slf4j
public class DataVersionBackfillHandler implements BackfillHandler {
    
    @Getter
    private final String workType;
    private final String table;
    private final String resourceIdColumn;
    private final int targetDataVersion;
    private final JdbcTemplate jdbcTemplate;
    
    public DataVersionBackfillHandler(String workType, String table, String resourceIdColumn,
                                      int targetDataVersion, JdbcTemplate jdbcTemplate) {
        SqlValidator.validateIdentifier(table);
        SqlValidator.validateIdentifier(resourceIdColumn);
        this.workType = workType;
        this.table = table;
        this.resourceIdColumn = resourceIdColumn;
        this.targetDataVersion = targetDataVersion;
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @Override
    public void backfill(WorkItem item) {
        int updated = jdbcTemplate.update(
            "update " + table + " set DATAVERSION = ? where " + resourceIdColumn + " = ? and DATAVERSION < ?",
            targetDataVersion, item.getResourceId(), targetDataVersion
        );
        log.debug("[Job-{}] {} {} data version {}", item.getJobId(), table, item.getResourceId(),
            updated == 1 ? "raised to " + targetDataVersion : "already current");
    }
}
