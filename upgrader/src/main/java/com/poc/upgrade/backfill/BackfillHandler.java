package com.poc.upgrade.backfill;

/**
 * Row-level data migration for one work type.
 * Jobs are delivered at least once, so implementations must be idempotent.
 */
public interface BackfillHandler {
    
    /**
     * Work type this handler executes.
     */
    String getWorkType();
    
    /**
     * Migrate the resource referenced by a claimed work item.
     * Runs in the transaction that completes the work item.
     */
    void backfill(WorkItem item);
}
