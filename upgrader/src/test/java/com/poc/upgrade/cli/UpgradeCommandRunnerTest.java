package com.poc.upgrade.cli;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.MigrationFailedException;
import com.poc.upgrade.exception.VersionConflictException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.runner.MigrationResult;
import com.poc.upgrade.service.SchemaStatus;
import com.poc.upgrade.service.SchemaUpgradeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UpgradeCommandRunner")
class UpgradeCommandRunnerTest {

    @Mock
    private SchemaUpgradeService upgradeService;

    private UpgradeProperties properties;
    private UpgradeCommandRunner runner;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        properties = new UpgradeProperties();
        runner = new UpgradeCommandRunner(upgradeService, properties);
        runner.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("exits with 0 after a successful upgrade")
    void upgradeSucceeds() {
        when(upgradeService.upgrade()).thenReturn(MigrationResult.builder()
            .dialect(Dialect.POSTGRESQL).startVersion(44).endVersion(46).stepsApplied(2).workItemsCreated(10).build());

        assertThat(runner.runCommand("upgrade")).isZero();
        assertThat(stdout()).contains("version 46").contains("2 steps applied");
    }

    @Test
    @DisplayName("exits with 0 when there is nothing to do")
    void upgradeNoOp() {
        when(upgradeService.upgrade()).thenReturn(MigrationResult.builder()
            .dialect(Dialect.POSTGRESQL).startVersion(46).endVersion(46).build());

        assertThat(runner.runCommand("upgrade")).isZero();
        assertThat(stdout()).contains("current at version 46");
    }

    @Test
    @DisplayName("exits with the failure's code and reports it on standard error")
    void upgradeFails() {
        when(upgradeService.upgrade())
            .thenThrow(new MigrationFailedException(45, "Step postgres-dialect 45->46 failed: syntax error", null));

        assertThat(runner.runCommand("upgrade")).isEqualTo(1);
        assertThat(stderr()).contains("MIGRATION_FAILED").contains("45->46");
    }

    @Test
    @DisplayName("exits with 2 on a persistent version conflict")
    void upgradeConflicts() {
        when(upgradeService.upgrade()).thenThrow(new VersionConflictException(44, 45));

        assertThat(runner.runCommand("upgrade")).isEqualTo(2);
    }

    @Test
    @DisplayName("status exits with 0 only when the schema is current")
    void statusReflectsCurrency() {
        when(upgradeService.status())
            .thenReturn(SchemaStatus.builder().dialect("oracle").currentVersion(46).latestVersion(46)
                .pendingSteps(List.of()).outstandingWork(Map.of()).build())
            .thenReturn(SchemaStatus.builder().dialect("oracle").currentVersion(45).latestVersion(46)
                .pendingSteps(List.of("oracle-dialect 45->46")).outstandingWork(Map.of()).build());

        assertThat(runner.runCommand("status")).isZero();
        assertThat(runner.runCommand("status")).isEqualTo(5);
        assertThat(stdout()).contains("oracle schema at version 45 of 46");
    }

    @Test
    @DisplayName("rejects an unknown command")
    void unknownCommand() {
        assertThat(runner.runCommand("downgrade")).isEqualTo(64);
        assertThat(stderr()).contains("Unknown upgrade command: downgrade");
        verifyNoInteractions(upgradeService);
    }

    @Test
    @DisplayName("records the command's exit code for the application")
    void runRecordsExitCode() {
        properties.setCommand("upgrade");
        when(upgradeService.upgrade()).thenThrow(new VersionConflictException(44, 45));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("upgrades on startup and lets a failure abort startup")
    void startupUpgradeFailureAborts() {
        properties.setRunOnStartup(true);
        when(upgradeService.upgrade()).thenThrow(new MigrationFailedException(44, new IllegalStateException("x")));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(MigrationFailedException.class);
        verify(upgradeService).upgrade();
    }

    @Test
    @DisplayName("does nothing at startup without a command or startup upgrade")
    void idleByDefault() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(upgradeService);
        assertThat(runner.getExitCode()).isZero();
    }
}
