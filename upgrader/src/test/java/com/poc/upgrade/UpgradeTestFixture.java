package com.poc.upgrade;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.upgrade.backfill.BackfillCoordinator;
import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.infrastructure.database.DialectResolver;
import com.poc.upgrade.infrastructure.database.RowInserter;
import com.poc.upgrade.jobqueue.JdbcJobQueue;
import com.poc.upgrade.jobqueue.JobQueue;
import com.poc.upgrade.ledger.JdbcVersionLedger;
import com.poc.upgrade.ledger.VersionLedger;
import com.poc.upgrade.registry.BackfillSpec;
import com.poc.upgrade.registry.SchemaOperation;
import com.poc.upgrade.registry.UpgradeStep;
import com.poc.upgrade.registry.UpgradeStepRegistry;
import com.poc.upgrade.runner.MigrationRunner;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Engine components wired by hand against a {@link SqliteTestDatabase}.
 */
public final class UpgradeTestFixture {

    public static final String WORK_TYPE = "calendar-object-upgrade";
    public static final String WORK_TABLE = "CALENDAR_OBJECT_UPGRADE_WORK";

    public final SqliteTestDatabase database;
    public final UpgradeProperties properties = new UpgradeProperties();
    public final DialectResolver dialectResolver;
    public final RowInserter rowInserter;
    public final JdbcVersionLedger ledger;
    public final JdbcJobQueue jobQueue;
    public final Clock clock;

    public UpgradeTestFixture(SqliteTestDatabase database) {
        this(database, Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    public UpgradeTestFixture(SqliteTestDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
        properties.setDialect("sqlite");
        dialectResolver = new DialectResolver(database.getDataSource(), properties);
        rowInserter = new RowInserter(database.getJdbcTemplate(), database.getTransactionTemplate());
        ledger = new JdbcVersionLedger(database.getJdbcTemplate(), properties);
        jobQueue = new JdbcJobQueue(database.getJdbcTemplate(), rowInserter, dialectResolver,
            new ObjectMapper(), properties, clock);
    }

    public BackfillCoordinator coordinator(JobQueue queue) {
        return new BackfillCoordinator(database.getJdbcTemplate(), queue, rowInserter);
    }

    public BackfillCoordinator coordinator() {
        return coordinator(jobQueue);
    }

    public MigrationRunner runner(List<UpgradeStep> steps) {
        return runner(steps, ledger, coordinator());
    }

    public MigrationRunner runner(List<UpgradeStep> steps, VersionLedger versionLedger, BackfillCoordinator backfillCoordinator) {
        return new MigrationRunner(new UpgradeStepRegistry(steps), versionLedger, backfillCoordinator,
            database.getJdbcTemplate(), database.getTransactionTemplate());
    }

    /**
     * 44 -> 45 adds a defaulted column to CALENDAR_OBJECT and backfills every existing row.
     */
    public static UpgradeStep addDataVersionColumn() {
        return UpgradeStep.builder()
            .dialect(Dialect.SQLITE)
            .fromVersion(44)
            .toVersion(45)
            .description("Data versions")
            .operation(SchemaOperation.of("alter table CALENDAR_OBJECT add column DATAVERSION integer default 0 not null"))
            .backfill(calendarObjectBackfill())
            .build();
    }

    /**
     * 45 -> 46 adds a table.
     */
    public static UpgradeStep addInboxCleanupTable() {
        return UpgradeStep.builder()
            .dialect(Dialect.SQLITE)
            .fromVersion(45)
            .toVersion(46)
            .description("Inbox cleanup work")
            .operation(SchemaOperation.of("create table INBOX_CLEANUP_WORK (WORK_ID integer primary key,"
                + " JOB_ID integer not null references JOB (JOB_ID))"))
            .build();
    }

    public static BackfillSpec calendarObjectBackfill() {
        return BackfillSpec.builder()
            .table("CALENDAR_OBJECT")
            .workTable(WORK_TABLE)
            .workType(WORK_TYPE)
            .build();
    }

    public static List<UpgradeStep> exampleChain() {
        return List.of(addDataVersionColumn(), addInboxCleanupTable());
    }
}
