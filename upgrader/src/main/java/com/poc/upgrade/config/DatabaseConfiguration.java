package com.poc.upgrade.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.upgrade.registry.UpgradeStepRegistry;
import com.poc.upgrade.registry.UpgradeStepSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Configuration for database-related beans.
 */
@Configuration
@EnableScheduling
public class DatabaseConfiguration {
    
    /**
     * ObjectMapper for step definitions and job payloads.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Registry validated eagerly so a broken chain fails startup.
     */
    @Bean
    public UpgradeStepRegistry upgradeStepRegistry(UpgradeStepSource stepSource) {
        return new UpgradeStepRegistry(stepSource.loadSteps());
    }
}
