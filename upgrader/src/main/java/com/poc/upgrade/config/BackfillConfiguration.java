package com.poc.upgrade.config;

import com.poc.upgrade.backfill.BackfillHandler;
import com.poc.upgrade.backfill.DataVersionBackfillHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Backfill handlers for the work types declared by the packaged upgrade steps.
 */
@Configuration
public class BackfillConfiguration {
    
    public static final String CALENDAR_OBJECT_UPGRADE = "calendar-object-upgrade";
    public static final String ADDRESSBOOK_OBJECT_UPGRADE = "addressbook-object-upgrade";
    
    @Bean
    public BackfillHandler calendarObjectUpgradeHandler(JdbcTemplate jdbcTemplate, UpgradeProperties properties) {
        return new DataVersionBackfillHandler(
            CALENDAR_OBJECT_UPGRADE, "CALENDAR_OBJECT", "RESOURCE_ID",
            properties.getBackfill().getTargetDataVersion(), jdbcTemplate);
    }
    
    @Bean
    public BackfillHandler addressBookObjectUpgradeHandler(JdbcTemplate jdbcTemplate, UpgradeProperties properties) {
        return new DataVersionBackfillHandler(
            ADDRESSBOOK_OBJECT_UPGRADE, "ADDRESSBOOK_OBJECT", "RESOURCE_ID",
            properties.getBackfill().getTargetDataVersion(), jdbcTemplate);
    }
}
