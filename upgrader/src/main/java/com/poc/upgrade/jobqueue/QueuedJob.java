package com.poc.upgrade.jobqueue;

import lombok.Value;

/**
 * Job claimed from the queue for execution.
 */
@Value
public class QueuedJob {
    long jobId;
    String workType;
    JobPayload payload;
    
    /**
     * Failed attempts before this claim.
     */
    int failures;
}
