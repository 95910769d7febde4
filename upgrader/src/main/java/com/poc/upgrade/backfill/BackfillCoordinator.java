package com.poc.upgrade.backfill;

import com.poc.upgrade.exception.BackfillException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.infrastructure.database.RowInserter;
import com.poc.upgrade.jobqueue.JobPayload;
import com.poc.upgrade.jobqueue.JobQueue;
import com.poc.upgrade.registry.BackfillSpec;
import com.poc.upgrade.registry.UpgradeStep;
import com.poc.upgrade.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records deferred row-level data migration as work items instead of performing it inline.
 * <p>
 * {@link #enqueueBackfill} runs inside the upgrade step's transaction, so the schema change
 * and the work items commit or roll back together. It never waits for the jobs to run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillCoordinator {
    
    private final JdbcTemplate jdbcTemplate;
    private final JobQueue jobQueue;
    private final RowInserter rowInserter;
    
    /**
     * Create one work item and one job per affected row of every backfill the step declares.
     * Rows that already have a work item are skipped, so repeating the call creates nothing new.
     *
     * @return number of work items created
     */
    public int enqueueBackfill(UpgradeStep step) {
        int created = 0;
        for (BackfillSpec spec : step.getBackfills()) {
            created += enqueue(step.getDialect(), spec);
        }
        log.info("[Upgrade-{}] Step {} recorded {} backfill work items",
            step.getDialect().getTypeName(), step.getName(), created);
        return created;
    }
    
    private int enqueue(Dialect dialect, BackfillSpec spec) {
        validate(spec);
        
        String idColumn = spec.getResourceIdColumn();
        String sql = "select s." + idColumn + " from " + spec.getTable() + " s"
            + " where " + (spec.getPredicate() == null ? "1 = 1" : "(" + spec.getPredicate() + ")")
            + " and not exists (select 1 from " + spec.getWorkTable() + " w"
            + " where w.RESOURCE_ID = s." + idColumn + ")"
            + " order by s." + idColumn;
        
        List<Long> resourceIds;
        try {
            resourceIds = jdbcTemplate.queryForList(sql, Long.class);
        } catch (DataAccessException e) {
            throw new BackfillException("Failed to select rows of " + spec.getTable() + " to backfill", e);
        }
        
        for (Long resourceId : resourceIds) {
            long jobId = jobQueue.enqueue(JobPayload.builder()
                .workType(spec.getWorkType())
                .workTable(spec.getWorkTable())
                .resourceId(resourceId)
                .build());
            
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("JOB_ID", jobId);
            columns.put("RESOURCE_ID", resourceId);
            rowInserter.insert(dialect, spec.getWorkTable(), "WORK_ID", "WORKITEM_SEQ", columns);
        }
        
        log.debug("{} work items queued in {} for {}", resourceIds.size(), spec.getWorkTable(), spec.getTable());
        return resourceIds.size();
    }
    
    /**
     * Lock and return the work item of a job. Must run inside the transaction that will complete it.
     * Empty when the item was removed because its resource was deleted, or when another
     * worker holds its row lock; {@link #pending} tells the two apart.
     */
    public Optional<WorkItem> claim(Dialect dialect, String workTable, long jobId) {
        return single(jobId, workTable, items(
            "select WORK_ID, JOB_ID, RESOURCE_ID from " + workTable + " where JOB_ID = ?" + dialect.getRowLockClause(),
            workTable, WorkItemState.CLAIMED, jobId
        ));
    }
    
    /**
     * The work item of a job as last committed, read without locking it.
     */
    public Optional<WorkItem> pending(String workTable, long jobId) {
        return single(jobId, workTable, items(
            "select WORK_ID, JOB_ID, RESOURCE_ID from " + workTable + " where JOB_ID = ?",
            workTable, WorkItemState.CREATED, jobId
        ));
    }
    
    /**
     * Retire a claimed work item after its backfill succeeded.
     */
    public WorkItem complete(WorkItem item) {
        if (item.getState() != WorkItemState.CLAIMED) {
            throw new IllegalStateException("Only claimed work items can be completed, not " + item.getState());
        }
        jdbcTemplate.update("delete from " + item.getWorkTable() + " where WORK_ID = ?", item.getWorkId());
        return item.withState(WorkItemState.COMPLETED);
    }
    
    /**
     * Remove pending work for a resource that is being deleted. The work table's
     * foreign key cascade does the same on databases that enforce it.
     *
     * @return the work items removed
     */
    public List<WorkItem> resourceDeleted(String workTable, long resourceId) {
        List<WorkItem> removed = items(
            "select WORK_ID, JOB_ID, RESOURCE_ID from " + workTable + " where RESOURCE_ID = ?",
            workTable, WorkItemState.REMOVED, resourceId
        );
        if (!removed.isEmpty()) {
            jdbcTemplate.update("delete from " + workTable + " where RESOURCE_ID = ?", resourceId);
            log.debug("Removed {} pending work items from {} for deleted resource {}",
                removed.size(), workTable, resourceId);
        }
        return removed;
    }
    
    /**
     * Work items not yet completed or removed.
     */
    public long countOutstanding(String workTable) {
        SqlValidator.validateIdentifier(workTable);
        Long count = jdbcTemplate.queryForObject("select count(*) from " + workTable, Long.class);
        return count == null ? 0 : count;
    }
    
    private List<WorkItem> items(String sql, String workTable, WorkItemState state, long key) {
        SqlValidator.validateIdentifier(workTable);
        return jdbcTemplate.query(sql,
            (rs, rowNum) -> new WorkItem(
                rs.getLong("WORK_ID"),
                rs.getLong("JOB_ID"),
                rs.getLong("RESOURCE_ID"),
                workTable,
                state
            ),
            key
        );
    }
    
    private static Optional<WorkItem> single(long jobId, String workTable, List<WorkItem> items) {
        if (items.size() > 1) {
            throw new BackfillException("Job " + jobId + " references " + items.size() + " work items in " + workTable);
        }
        return items.stream().findFirst();
    }
    
    private void validate(BackfillSpec spec) {
        try {
            SqlValidator.validateIdentifier(spec.getTable());
            SqlValidator.validateIdentifier(spec.getResourceIdColumn());
            SqlValidator.validateIdentifier(spec.getWorkTable());
            SqlValidator.validatePredicate(spec.getPredicate());
        } catch (IllegalArgumentException e) {
            throw new BackfillException("Invalid backfill of " + spec.getTable() + ": " + e.getMessage(), e);
        }
    }
}
