package com.poc.upgrade.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the schema version and outstanding backfill work.
 */
@Value
@Builder
public class SchemaStatus {
    String dialect;
    int currentVersion;
    int latestVersion;
    
    /**
     * Names of the steps still to apply, in order.
     */
    List<String> pendingSteps;
    
    /**
     * Outstanding work items per work table.
     */
    Map<String, Long> outstandingWork;
    
    public boolean isCurrent() {
        return currentVersion == latestVersion;
    }
}
