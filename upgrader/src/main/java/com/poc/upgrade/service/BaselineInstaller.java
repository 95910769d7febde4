package com.poc.upgrade.service;

import com.poc.upgrade.config.UpgradeProperties;
import com.poc.upgrade.exception.MigrationException;
import com.poc.upgrade.infrastructure.database.Dialect;
import com.poc.upgrade.ledger.VersionLedger;
import com.poc.upgrade.registry.UpgradeChain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Installs the baseline schema into an empty database, at the lowest version
 * of the upgrade chain, so that the chain can take it the rest of the way.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineInstaller {
    
    private final VersionLedger ledger;
    private final DataSource dataSource;
    private final ResourceLoader resourceLoader;
    private final TransactionTemplate transactionTemplate;
    private final UpgradeProperties properties;
    
    /**
     * Install the baseline when enabled and the ledger table is missing.
     *
     * @return true if the baseline was installed
     */
    public boolean installIfNeeded(Dialect dialect, UpgradeChain chain) {
        if (!properties.getBaseline().isEnabled() || ledger.exists()) {
            return false;
        }
        
        String location = properties.getBaseline().getLocation().replace("{tag}", dialect.getTag());
        Resource script = resourceLoader.getResource(location);
        if (!script.exists()) {
            throw new MigrationException("No baseline schema for " + dialect.getTypeName() + " at " + location);
        }
        
        int baselineVersion = chain.getMinimumVersion();
        log.info("[Upgrade-{}] Installing baseline schema at version {} from {}",
            dialect.getTypeName(), baselineVersion, location);
        
        transactionTemplate.executeWithoutResult(status -> {
            Connection conn = DataSourceUtils.getConnection(dataSource);
            ScriptUtils.executeSqlScript(conn, script);
            ledger.initialize(baselineVersion);
        });
        
        log.info("[Upgrade-{}] Baseline schema installed", dialect.getTypeName());
        return true;
    }
}
