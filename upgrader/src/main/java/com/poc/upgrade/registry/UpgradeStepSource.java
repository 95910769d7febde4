package com.poc.upgrade.registry;

import java.util.List;

/**
 * Supplies the upgrade step definitions available to the registry.
 */
public interface UpgradeStepSource {
    
    /**
     * Load every step definition, for all dialects.
     */
    List<UpgradeStep> loadSteps();
}
