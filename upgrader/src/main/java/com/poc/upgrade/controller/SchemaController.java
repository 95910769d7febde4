package com.poc.upgrade.controller;

import com.poc.upgrade.runner.MigrationResult;
import com.poc.upgrade.service.SchemaStatus;
import com.poc.upgrade.service.SchemaUpgradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for schema version status and administrative upgrades.
 * Exception handling is centralized in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/schema")
@RequiredArgsConstructor
@Slf4j
public class SchemaController {

    private final SchemaUpgradeService upgradeService;

    /**
     * Current and latest schema version with the steps still pending.
     */
    @GetMapping
    public ResponseEntity<SchemaStatus> getStatus() {
        return ResponseEntity.ok(upgradeService.status());
    }

    /**
     * Outstanding backfill work per work table.
     */
    @GetMapping("/backfill")
    public ResponseEntity<Map<String, Long>> getBackfill() {
        return ResponseEntity.ok(upgradeService.status().getOutstandingWork());
    }

    /**
     * Upgrade the schema to the latest version. Returns once all steps are committed;
     * backfill continues in the background.
     */
    @PostMapping("/upgrade")
    public ResponseEntity<MigrationResult> upgrade() {
        log.info("Received schema upgrade request");
        
        MigrationResult result = upgradeService.upgrade();
        
        log.info("Schema upgrade request finished at version {}", result.getEndVersion());
        return ResponseEntity.ok(result);
    }
}
