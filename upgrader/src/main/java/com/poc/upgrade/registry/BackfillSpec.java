package com.poc.upgrade.registry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declares that rows of a table need asynchronous data migration after a step commits.
 * One work item is recorded per selected row in {@code workTable}.
 */
@Value
@Builder
public class BackfillSpec {
    
    /**
     * Table whose rows are backfilled.
     */
    @NonNull String table;
    
    /**
     * Identifier column of {@link #table}, referenced by the work items.
     */
    @Builder.Default
    String resourceIdColumn = "RESOURCE_ID";
    
    /**
     * Boolean SQL expression over {@link #table} selecting the affected rows; null selects all rows.
     */
    String predicate;
    
    /**
     * Table holding (WORK_ID, JOB_ID, RESOURCE_ID) work items.
     */
    @NonNull String workTable;
    
    /**
     * Job work type, used to find the handler that executes the backfill.
     */
    @NonNull String workType;
}
