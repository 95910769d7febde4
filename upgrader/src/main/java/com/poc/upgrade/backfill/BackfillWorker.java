package com.poc.upgrade.backfill;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.infrastructure.database.DialectResolver;
import com.poc.upgrade.jobqueue.JobQueue;
import com.poc.upgrade.jobqueue.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drains backfill jobs from the job queue.
 * <p>
 * Each job is claimed in its own transaction, then its work item is locked,
 * backfilled and retired together with the job in a second transaction.
 * A failure rolls that transaction back and leaves retry or parking to the
 * queue; the schema version is never touched.
 */
@Component
@Slf4j
public class BackfillWorker {
    
    private final JobQueue jobQueue;
    private final BackfillCoordinator coordinator;
    private final DialectResolver dialectResolver;
    private final TransactionTemplate transactionTemplate;
    private final UpgradeProperties properties;
    private final Map<String, BackfillHandler> handlers = new LinkedHashMap<>();
    
    public BackfillWorker(JobQueue jobQueue,
                          BackfillCoordinator coordinator,
                          DialectResolver dialectResolver,
                          TransactionTemplate transactionTemplate,
                          UpgradeProperties properties,
                          List<BackfillHandler> handlers) {
        this.jobQueue = jobQueue;
        this.coordinator = coordinator;
        this.dialectResolver = dialectResolver;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        for (BackfillHandler handler : handlers) {
            BackfillHandler previous = this.handlers.put(handler.getWorkType(), handler);
            if (previous != null) {
                throw new IllegalStateException("More than one backfill handler for work type " + handler.getWorkType());
            }
        }
    }
    
    /**
     * Scheduled poll of the job queue.
     */
    @Scheduled(
        initialDelayString = "${upgrade.backfill.poll-interval-ms:5000}",
        fixedDelayString = "${upgrade.backfill.poll-interval-ms:5000}"
    )
    public void poll() {
        if (!properties.getBackfill().isEnabled() || handlers.isEmpty()) {
            return;
        }
        
        try {
            int processed = drain(properties.getBackfill().getBatchSize());
            if (processed > 0) {
                log.info("Backfill poll processed {} jobs", processed);
            }
        } catch (RuntimeException e) {
            // The next poll retries; claimed jobs are recovered after the lease timeout
            log.error("Backfill poll failed: {}", e.getMessage(), e);
        }
    }
    
    /**
     * Claim and execute up to {@code maxJobs} due jobs.
     *
     * @return number of jobs executed, successfully or not
     */
    public int drain(int maxJobs) {
        int processed = 0;
        while (processed < maxJobs) {
            Optional<QueuedJob> job = transactionTemplate.execute(status -> jobQueue.claimNext(handlers.keySet()));
            if (job == null || job.isEmpty()) {
                break;
            }
            execute(job.get());
            processed++;
        }
        return processed;
    }
    
    /**
     * Execute one claimed job.
     *
     * @return true if the job completed
     */
    boolean execute(QueuedJob job) {
        BackfillHandler handler = handlers.get(job.getWorkType());
        String workTable = job.getPayload().getWorkTable();
        
        try {
            Boolean completed = transactionTemplate.execute(status -> {
                Optional<WorkItem> item = coordinator.claim(dialectResolver.current(), workTable, job.getJobId());
                if (item.isPresent()) {
                    handler.backfill(item.get());
                    coordinator.complete(item.get());
                } else if (coordinator.pending(workTable, job.getJobId()).isPresent()) {
                    // Locked by a worker whose lease expired; it retires or fails the job itself
                    log.info("[Job-{}] Work item in {} is held by another worker; leaving the job to it",
                        job.getJobId(), workTable);
                    return false;
                } else {
                    log.info("[Job-{}] No work item left in {}; resource {} was deleted",
                        job.getJobId(), workTable, job.getPayload().getResourceId());
                }
                jobQueue.complete(job.getJobId());
                return true;
            });
            return Boolean.TRUE.equals(completed);
            
        } catch (RuntimeException e) {
            log.warn("[Job-{}] Backfill of {} resource {} failed: {}",
                job.getJobId(), job.getWorkType(), job.getPayload().getResourceId(), e.getMessage());
            transactionTemplate.executeWithoutResult(status -> jobQueue.fail(job.getJobId(), String.valueOf(e.getMessage())));
            return false;
        }
    }
    
    public Map<String, BackfillHandler> getHandlers() {
        return Map.copyOf(handlers);
    }
}
