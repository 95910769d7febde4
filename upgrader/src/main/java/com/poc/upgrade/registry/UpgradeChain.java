package com.poc.upgrade.registry;

import com.poc.upgrade.exception.RegistryException;
import com.poc.upgrade.infrastructure.database.Dialect;
import lombok.Getter;

import java.util.List;

/**
 * Validated, ordered chain of upgrade steps for one dialect.
 */
@Getter
public class UpgradeChain {
    
    private final Dialect dialect;
    private final List<UpgradeStep> steps;
    
    UpgradeChain(Dialect dialect, List<UpgradeStep> orderedSteps) {
        this.dialect = dialect;
        this.steps = List.copyOf(orderedSteps);
    }
    
    public int getMinimumVersion() {
        return steps.get(0).getFromVersion();
    }
    
    public int getLatestVersion() {
        return steps.get(steps.size() - 1).getToVersion();
    }
    
    /**
     * Steps to apply, in order, to bring a schema at {@code currentVersion} to the latest version.
     * Empty when the schema is already current.
     */
    public List<UpgradeStep> stepsFrom(int currentVersion) {
        if (currentVersion == getLatestVersion()) {
            return List.of();
        }
        if (currentVersion < getMinimumVersion() || currentVersion > getLatestVersion()) {
            throw new RegistryException(String.format(
                "No %s upgrade path from version %d; known versions are %d to %d",
                dialect.getTypeName(), currentVersion, getMinimumVersion(), getLatestVersion()
            ));
        }
        return steps.subList(currentVersion - getMinimumVersion(), steps.size());
    }
}
