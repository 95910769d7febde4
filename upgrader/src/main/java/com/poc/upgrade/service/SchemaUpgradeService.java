package com.poc.upgrade.service;

import com.poc.upgrade.backfill.BackfillCoordinator;
import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.VersionConflictException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.infrastructure.database.DialectResolver;
import com.poc.upgrade.ledger.VersionLedger;
import com.poc.upgrade.registry.BackfillSpec;
import com.poc.upgrade.registry.UpgradeChain;
import com.poc.upgrade.registry.UpgradeStep;
import com.poc.upgrade.registry.UpgradeStepRegistry;
import com.poc.upgrade.runner.MigrationResult;
import com.poc.upgrade.runner.MigrationRunner;
import com.poc.upgrade.util.RetryUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Entry point for upgrading the application's database and reporting its state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaUpgradeService {
    
    private final DialectResolver dialectResolver;
    private final UpgradeStepRegistry registry;
    private final VersionLedger ledger;
    private final MigrationRunner migrationRunner;
    private final BaselineInstaller baselineInstaller;
    private final BackfillCoordinator coordinator;
    private final UpgradeProperties properties;
    
    /**
     * Upgrade the schema to the latest version.
     * A version conflict means another process is upgrading the same database;
     * the version is re-read and the remaining steps recomputed, up to the
     * configured number of retries, after which the conflict is surfaced.
     */
    public MigrationResult upgrade() {
        Dialect dialect = dialectResolver.current();
        UpgradeChain chain = registry.load(dialect);
        baselineInstaller.installIfNeeded(dialect, chain);
        
        UpgradeProperties.ConflictConfig conflict = properties.getConflict();
        return RetryUtil.executeWithRetry(
            () -> migrationRunner.run(dialect),
            VersionConflictException.class,
            conflict.getMaxRetries() + 1,
            conflict.getDelayMs(),
            "schema upgrade (" + dialect.getTypeName() + ")"
        );
    }
    
    /**
     * Current version, pending steps and outstanding backfill work.
     */
    public SchemaStatus status() {
        Dialect dialect = dialectResolver.current();
        UpgradeChain chain = registry.load(dialect);
        int current = ledger.currentVersion();
        List<UpgradeStep> pending = chain.stepsFrom(current);
        
        Map<String, Long> outstanding = new TreeMap<>();
        chain.getSteps().stream()
            .filter(step -> step.getToVersion() <= current)
            .flatMap(step -> step.getBackfills().stream())
            .map(BackfillSpec::getWorkTable)
            .distinct()
            .forEach(workTable -> outstanding.put(workTable, coordinator.countOutstanding(workTable)));
        
        return SchemaStatus.builder()
            .dialect(dialect.getTypeName())
            .currentVersion(current)
            .latestVersion(chain.getLatestVersion())
            .pendingSteps(pending.stream().map(UpgradeStep::getName).collect(Collectors.toList()))
            .outstandingWork(outstanding)
            .build();
    }
}
