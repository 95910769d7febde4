package com.poc.upgrade.backfill;

import lombok.Value;
import lombok.With;

/**
 * One unit of deferred data migration: the resource to backfill and the job that does it.
 */
@Value
public class WorkItem {
    long workId;
    long jobId;
    long resourceId;
    String workTable;
    @With WorkItemState state;
}
