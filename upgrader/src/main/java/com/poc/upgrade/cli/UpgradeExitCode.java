package com.poc.upgrade.cli;

import com.poc.upgrade.exception.MigrationFailedException;
import com.poc.upgrade.exception.RegistryException;
import com.poc.upgrade.exception.UnsupportedDialectException;
import com.poc.upgrade.exception.VersionConflictException;

/**
 * Process exit codes of the administrative upgrade command.
 */
public enum UpgradeExitCode {
    SUCCESS(0),
    MIGRATION_FAILED(1),
    VERSION_CONFLICT(2),
    REGISTRY_ERROR(3),
    UNSUPPORTED_DIALECT(4),
    /** {@code status} found steps not yet applied. */
    SCHEMA_BEHIND(5),
    /** The command name was not recognised. */
    USAGE_ERROR(64);

    private final int code;

    UpgradeExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Exit code for a failure, looking through wrapping exceptions.
     * Anything unrecognised counts as a failed migration.
     */
    public static UpgradeExitCode of(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof VersionConflictException) {
                return VERSION_CONFLICT;
            }
            if (t instanceof RegistryException) {
                return REGISTRY_ERROR;
            }
            if (t instanceof UnsupportedDialectException) {
                return UNSUPPORTED_DIALECT;
            }
            if (t instanceof MigrationFailedException) {
                return MIGRATION_FAILED;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return MIGRATION_FAILED;
    }
}
