package com.poc.upgrade.runner;

import com.poc.upgrade.backfill.BackfillCoordinator;
import com.poc.upgrade.exception.MigrationFailedException;
import com.poc.upgrade.exception.VersionConflictException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.ledger.VersionLedger;
import com.poc.upgrade.registry.SchemaOperation;
import com.poc.upgrade.registry.UpgradeStep;
import com.poc.upgrade.registry.UpgradeStepRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Applies the outstanding upgrade steps of a dialect, one transaction per step.
 * <p>
 * Each step's DDL, its backfill work items and the ledger advance commit
 * together. A failing step is rolled back and aborts the run; steps committed
 * before it stay applied, so the next run resumes from the advanced version.
 * Steps are applied strictly in chain order and never skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MigrationRunner {
    
    private final UpgradeStepRegistry registry;
    private final VersionLedger ledger;
    private final BackfillCoordinator coordinator;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    
    /**
     * Bring the schema to the latest version known for {@code dialect}.
     *
     * @throws MigrationFailedException if a step fails
     * @throws VersionConflictException if another runner moved the version
     */
    public MigrationResult run(Dialect dialect) {
        String tag = dialect.getTypeName();
        int startVersion = ledger.currentVersion();
        List<UpgradeStep> steps = registry.load(dialect).stepsFrom(startVersion);
        
        if (steps.isEmpty()) {
            log.info("[Upgrade-{}] Schema is current at version {}", tag, startVersion);
            return MigrationResult.builder()
                .dialect(dialect)
                .startVersion(startVersion)
                .endVersion(startVersion)
                .build();
        }
        
        log.info("[Upgrade-{}] ========== UPGRADE STARTED: {} -> {} ({} steps) ==========",
            tag, startVersion, steps.get(steps.size() - 1).getToVersion(), steps.size());
        if (!dialect.isTransactionalDdl()) {
            log.warn("[Upgrade-{}] DDL is not transactional on this database; a failed step may leave partial schema changes",
                tag);
        }
        
        int version = startVersion;
        int workItems = 0;
        for (UpgradeStep step : steps) {
            workItems += applyStep(step);
            version = step.getToVersion();
        }
        
        log.info("[Upgrade-{}] ========== UPGRADE COMPLETE at version {} ==========", tag, version);
        return MigrationResult.builder()
            .dialect(dialect)
            .startVersion(startVersion)
            .endVersion(version)
            .stepsApplied(steps.size())
            .workItemsCreated(workItems)
            .build();
    }
    
    /**
     * Apply one step in its own transaction.
     *
     * @return number of backfill work items recorded
     */
    private int applyStep(UpgradeStep step) {
        String tag = step.getDialect().getTypeName();
        log.info("[Upgrade-{}] Starting step {}{}", tag, step.getName(),
            step.getDescription() == null ? "" : ": " + step.getDescription());
        
        try {
            Integer created = transactionTemplate.execute(status -> {
                int current = ledger.lockCurrentVersion();
                if (current != step.getFromVersion()) {
                    throw new VersionConflictException(step.getFromVersion(), current);
                }
                
                for (SchemaOperation operation : step.getOperations()) {
                    if (operation.getDescription() != null) {
                        log.debug("[Upgrade-{}] {}", tag, operation.getDescription());
                    }
                    jdbcTemplate.execute(operation.getSql());
                }
                
                int items = step.requiresBackfill() ? coordinator.enqueueBackfill(step) : 0;
                ledger.advance(step.getFromVersion(), step.getToVersion());
                return items;
            });
            
            log.info("[Upgrade-{}] Completed step {}", tag, step.getName());
            return created == null ? 0 : created;
            
        } catch (VersionConflictException e) {
            log.warn("[Upgrade-{}] Step {} abandoned: {}", tag, step.getName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[Upgrade-{}] Failed step {}; rolled back at version {}",
                tag, step.getName(), step.getFromVersion());
            throw new MigrationFailedException(
                step.getFromVersion(),
                "Step " + step.getName() + " failed: " + e.getMessage(),
                e
            );
        }
    }
}
