package com.poc.upgrade.runner;

import com.poc.upgrade.infrastructure.database.Dialect;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a completed migration run.
 */
@Value
@Builder
public class MigrationResult {
    Dialect dialect;
    int startVersion;
    int endVersion;
    int stepsApplied;
    int workItemsCreated;

    public boolean isNoOp() {
        return stepsApplied == 0;
    }
}
