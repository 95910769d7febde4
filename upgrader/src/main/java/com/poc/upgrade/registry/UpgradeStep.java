package com.poc.upgrade.registry;

import com.poc.upgrade.infrastructure.database.Dialect;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One versioned schema transformation from {@code fromVersion} to {@code toVersion} for a dialect.
 */
@Value
@Builder
public class UpgradeStep {
    @NonNull Dialect dialect;
    int fromVersion;
    int toVersion;
    String description;
    @Singular List<SchemaOperation> operations;
    @Singular List<BackfillSpec> backfills;

    public boolean requiresBackfill() {
        return !backfills.isEmpty();
    }

    /**
     * Identity used in logs and errors, e.g. {@code postgres-dialect 44->45}.
     */
    public String getName() {
        return dialect.getTag() + " " + fromVersion + "->" + toVersion;
    }

    @Override
    public String toString() {
        return getName();
    }
}
