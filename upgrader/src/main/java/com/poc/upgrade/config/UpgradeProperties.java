package com.poc.upgrade.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for schema upgrade operations.
 */
@Configuration
@ConfigurationProperties(prefix = "upgrade")
@Validated
@Data
public class UpgradeProperties {
    
    /**
     * Explicit dialect (postgresql, oracle, sqlite). Detected from the connection when blank.
     */
    private String dialect;
    
    /**
     * Upgrade the schema while the application starts; startup aborts on failure.
     */
    private boolean runOnStartup = false;
    
    /**
     * Administrative command to run once before exiting ("upgrade" or "status").
     */
    private String command;
    
    @Valid
    private LedgerConfig ledger = new LedgerConfig();
    
    @Valid
    private StepsConfig steps = new StepsConfig();
    
    @Valid
    private BackfillConfig backfill = new BackfillConfig();
    
    @Valid
    private ConflictConfig conflict = new ConflictConfig();
    
    @Valid
    private BaselineConfig baseline = new BaselineConfig();
    
    @Data
    public static class LedgerConfig {
        /**
         * Two-column (NAME, VALUE) table holding the schema version.
         */
        @NotBlank
        private String table = "CALENDARSERVER";
        
        /**
         * NAME of the row holding the version.
         */
        @NotBlank
        private String versionKey = "VERSION";
    }
    
    @Data
    public static class StepsConfig {
        /**
         * Resource pattern matching the packaged step definitions.
         */
        @NotBlank
        private String location = "classpath*:schema/upgrades/*/*.json";
    }
    
    @Data
    public static class BackfillConfig {
        /**
         * Whether this process drains backfill jobs.
         */
        private boolean enabled = true;
        
        /**
         * Interval between job queue polls (milliseconds).
         */
        @Min(100)
        private long pollIntervalMs = 5000;
        
        /**
         * Maximum number of jobs claimed per poll.
         */
        @Min(1)
        private int batchSize = 50;
        
        /**
         * Attempts before a failing job is parked.
         */
        @Min(1)
        private int maxAttempts = 5;
        
        /**
         * Base delay before a failed job is retried (milliseconds), multiplied by the attempt count.
         */
        @Min(0)
        private long retryDelayMs = 60000;
        
        /**
         * Time after which a claimed but unfinished job may be claimed again (milliseconds).
         */
        @Min(1000)
        private long leaseTimeoutMs = 600000;
        
        /**
         * Data version written to rows upgraded by the data version handlers.
         */
        @Min(1)
        private int targetDataVersion = 1;
    }
    
    @Data
    public static class ConflictConfig {
        /**
         * Times a version conflict is answered by re-reading the version and running again.
         */
        @Min(0)
        private int maxRetries = 3;
        
        /**
         * Delay before re-reading the version after a conflict (milliseconds).
         */
        @Min(0)
        private long delayMs = 1000;
    }
    
    @Data
    public static class BaselineConfig {
        /**
         * Install the baseline schema when the ledger table does not exist.
         */
        private boolean enabled = false;
        
        /**
         * Location of the baseline scripts; {tag} is replaced by the dialect tag.
         */
        @NotBlank
        private String location = "classpath:schema/baseline/{tag}.sql";
    }
}
