package com.poc.upgrade;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * File-backed SQLite database with foreign keys enforced, for tests that need real transactions.
 */
public final class SqliteTestDatabase {

    private final SQLiteDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    private SqliteTestDatabase(SQLiteDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public static SqliteTestDatabase create(Path directory) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(5000);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + directory.resolve("upgrade-test.db").toAbsolutePath());
        return new SqliteTestDatabase(dataSource);
    }

    /**
     * Version 44 schema used by the engine tests: ledger, job table, one resource
     * table and its upgrade work table.
     */
    public SqliteTestDatabase withVersion44Schema() {
        jdbcTemplate.execute("create table CALENDARSERVER (NAME varchar(255) primary key, VALUE varchar(255))");
        jdbcTemplate.execute("create table JOB (JOB_ID integer primary key, WORK_TYPE varchar(255) not null,"
            + " PAYLOAD text, NOT_BEFORE timestamp not null, ASSIGNED timestamp default null,"
            + " FAILED integer default 0 not null, PAUSE integer default 0 not null, LAST_ERROR text)");
        jdbcTemplate.execute("create table CALENDAR_OBJECT (RESOURCE_ID integer primary key,"
            + " RESOURCE_NAME varchar(255) not null)");
        jdbcTemplate.execute("create table CALENDAR_OBJECT_UPGRADE_WORK (WORK_ID integer primary key,"
            + " JOB_ID integer not null references JOB (JOB_ID),"
            + " RESOURCE_ID integer not null references CALENDAR_OBJECT (RESOURCE_ID) on delete cascade)");
        jdbcTemplate.execute("create unique index CALENDAR_OBJECT_UPGRA_a5c181eb"
            + " on CALENDAR_OBJECT_UPGRADE_WORK (RESOURCE_ID)");
        jdbcTemplate.update("insert into CALENDARSERVER (NAME, VALUE) values ('VERSION', '44')");
        return this;
    }

    public void insertCalendarObjects(int count) {
        for (int i = 1; i <= count; i++) {
            jdbcTemplate.update("insert into CALENDAR_OBJECT (RESOURCE_ID, RESOURCE_NAME) values (?, ?)",
                i, "event-" + i + ".ics");
        }
    }

    public List<String> columnsOf(String table) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList("pragma table_info(" + table + ")");
        return rows.stream()
            .map(row -> String.valueOf(row.get("name")).toUpperCase())
            .collect(Collectors.toList());
    }

    public boolean tableExists(String table) {
        Integer count = jdbcTemplate.queryForObject(
            "select count(*) from sqlite_master where type = 'table' and upper(name) = upper(?)",
            Integer.class, table);
        return count != null && count > 0;
    }

    public int storedVersion() {
        return Integer.parseInt(jdbcTemplate.queryForObject(
            "select VALUE from CALENDARSERVER where NAME = 'VERSION'", String.class));
    }

    public long count(String table) {
        Long count = jdbcTemplate.queryForObject("select count(*) from " + table, Long.class);
        return count == null ? 0 : count;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    public TransactionTemplate getTransactionTemplate() {
        return transactionTemplate;
    }
}
