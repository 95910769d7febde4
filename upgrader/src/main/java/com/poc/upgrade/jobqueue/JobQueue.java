package com.poc.upgrade.jobqueue;

import java.util.Collection;
import java.util.Optional;

/**
 * Boundary to the job system that executes deferred work.
 * The upgrade coordinator only needs {@link #enqueue}; the remaining
 * primitives serve the backfill worker.
 */
public interface JobQueue {
    
    /**
     * Durably record a job and return its id. Joins the caller's transaction.
     */
    long enqueue(JobPayload payload);
    
    /**
     * Claim the next due job of one of the given work types, if any.
     */
    Optional<QueuedJob> claimNext(Collection<String> workTypes);
    
    /**
     * Remove a finished job.
     */
    void complete(long jobId);
    
    /**
     * Record a failed attempt; the job is retried later or parked after too many failures.
     *
     * A job that no longer exists is ignored.
     *
     * @return true if the job was parked
     */
    boolean fail(long jobId, String error);
    
    /**
     * Number of jobs not yet completed, parked ones included.
     */
    long countOutstanding(String workType);
}
