package com.poc.upgrade.cli;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.runner.MigrationResult;
import com.poc.upgrade.service.SchemaStatus;
import com.poc.upgrade.service.SchemaUpgradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Process boundary of the upgrade engine.
 * <p>
 * With {@code upgrade.command} set the application runs that command once and
 * reports the outcome through its exit code. With {@code upgrade.run-on-startup}
 * the schema is upgraded while the server starts, and a failure aborts startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UpgradeCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    
    public static final String UPGRADE = "upgrade";
    public static final String STATUS = "status";
    
    private final SchemaUpgradeService upgradeService;
    private final UpgradeProperties properties;
    
    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private int exitCode = UpgradeExitCode.SUCCESS.getCode();
    
    @Override
    public void run(ApplicationArguments args) {
        String command = properties.getCommand();
        if (command != null) {
            exitCode = runCommand(command);
            return;
        }
        
        if (properties.isRunOnStartup()) {
            log.info("Upgrading schema before startup completes");
            upgradeService.upgrade();
        }
    }
    
    /**
     * Run an administrative command.
     *
     * @return the process exit code
     */
    int runCommand(String command) {
        try {
            if (UPGRADE.equalsIgnoreCase(command)) {
                MigrationResult result = upgradeService.upgrade();
                if (result.isNoOp()) {
                    out.printf("Schema is current at version %d%n", result.getEndVersion());
                    return UpgradeExitCode.SUCCESS.getCode();
                }
                out.printf("Schema at version %d (%d steps applied, %d backfill work items queued)%n",
                    result.getEndVersion(), result.getStepsApplied(), result.getWorkItemsCreated());
                return UpgradeExitCode.SUCCESS.getCode();
            }
            if (STATUS.equalsIgnoreCase(command)) {
                SchemaStatus status = upgradeService.status();
                out.printf("%s schema at version %d of %d; pending steps: %s; outstanding work: %s%n",
                    status.getDialect(), status.getCurrentVersion(), status.getLatestVersion(),
                    status.getPendingSteps(), status.getOutstandingWork());
                return status.isCurrent() ? UpgradeExitCode.SUCCESS.getCode() : UpgradeExitCode.SCHEMA_BEHIND.getCode();
            }
            err.println("Unknown upgrade command: " + command + " (expected '" + UPGRADE + "' or '" + STATUS + "')");
            return UpgradeExitCode.USAGE_ERROR.getCode();
            
        } catch (RuntimeException e) {
            UpgradeExitCode code = UpgradeExitCode.of(e);
            log.error("Upgrade command '{}' failed: {}", command, e.getMessage(), e);
            err.println("Schema upgrade failed (" + code + "): " + e.getMessage());
            return code.getCode();
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    void setOutput(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }
}
