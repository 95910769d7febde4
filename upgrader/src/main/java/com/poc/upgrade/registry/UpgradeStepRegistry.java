package com.poc.upgrade.registry;

import com.poc.upgrade.exception.RegistryException;
import com.poc.upgrade.infrastructure.database.Dialect;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of upgrade chains keyed by dialect.
 * All chains are validated when the registry is built; any gap, branch or
 * cross-dialect mismatch is a {@link RegistryException}.
 */
@Slf4j
public class UpgradeStepRegistry {
    
    private final Map<Dialect, UpgradeChain> chains = new EnumMap<>(Dialect.class);
    
    public UpgradeStepRegistry(Collection<UpgradeStep> steps) {
        Map<Dialect, List<UpgradeStep>> byDialect = new EnumMap<>(Dialect.class);
        for (UpgradeStep step : steps) {
            byDialect.computeIfAbsent(step.getDialect(), d -> new ArrayList<>()).add(step);
        }
        
        byDialect.forEach((dialect, dialectSteps) -> chains.put(dialect, buildChain(dialect, dialectSteps)));
        validateParity();
        
        chains.values().forEach(chain -> log.info("Registered {} upgrade steps for {} ({} -> {})",
            chain.getSteps().size(), chain.getDialect().getTypeName(),
            chain.getMinimumVersion(), chain.getLatestVersion()));
    }
    
    /**
     * Ordered chain for a dialect.
     */
    public UpgradeChain load(Dialect dialect) {
        UpgradeChain chain = chains.get(dialect);
        if (chain == null) {
            throw new RegistryException("No upgrade steps are registered for dialect " + dialect.getTypeName());
        }
        return chain;
    }
    
    public Set<Dialect> getDialects() {
        return chains.keySet();
    }
    
    private UpgradeChain buildChain(Dialect dialect, List<UpgradeStep> dialectSteps) {
        TreeMap<Integer, UpgradeStep> byFromVersion = new TreeMap<>();
        
        for (UpgradeStep step : dialectSteps) {
            if (step.getToVersion() != step.getFromVersion() + 1) {
                throw new RegistryException(String.format(
                    "Step %s must advance exactly one version", step.getName()
                ));
            }
            UpgradeStep previous = byFromVersion.put(step.getFromVersion(), step);
            if (previous != null) {
                throw new RegistryException(String.format(
                    "Branch in %s chain: more than one step upgrades from version %d",
                    dialect.getTypeName(), step.getFromVersion()
                ));
            }
        }
        
        List<UpgradeStep> ordered = new ArrayList<>(byFromVersion.values());
        ordered.sort(Comparator.comparingInt(UpgradeStep::getFromVersion));
        for (int i = 1; i < ordered.size(); i++) {
            int expected = ordered.get(i - 1).getToVersion();
            int actual = ordered.get(i).getFromVersion();
            if (actual != expected) {
                throw new RegistryException(String.format(
                    "Gap in %s chain: no step upgrades from version %d (next step starts at %d)",
                    dialect.getTypeName(), expected, actual
                ));
            }
        }
        return new UpgradeChain(dialect, ordered);
    }
    
    private void validateParity() {
        UpgradeChain reference = null;
        for (UpgradeChain chain : chains.values()) {
            if (reference == null) {
                reference = chain;
                continue;
            }
            if (chain.getMinimumVersion() != reference.getMinimumVersion()
                    || chain.getLatestVersion() != reference.getLatestVersion()) {
                throw new RegistryException(String.format(
                    "Dialect chains disagree: %s covers %d -> %d but %s covers %d -> %d",
                    reference.getDialect().getTypeName(), reference.getMinimumVersion(), reference.getLatestVersion(),
                    chain.getDialect().getTypeName(), chain.getMinimumVersion(), chain.getLatestVersion()
                ));
            }
        }
    }
}
