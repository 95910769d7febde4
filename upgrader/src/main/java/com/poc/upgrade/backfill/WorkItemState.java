package com.poc.upgrade.backfill;

/**
 * Lifecycle of a work item.
 * {@code CREATED -> CLAIMED -> COMPLETED}, or {@code CREATED -> REMOVED} when
 * the referenced resource is deleted before the job runs.
 */
public enum WorkItemState {
    /** Recorded and waiting for its job; not locked by the reader. */
    CREATED,
    /** Row-locked by a worker inside the transaction that backfills it. */
    CLAIMED,
    COMPLETED,
    REMOVED
}
