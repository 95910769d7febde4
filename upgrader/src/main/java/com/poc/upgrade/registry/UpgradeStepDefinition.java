package com.poc.upgrade.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.poc.upgrade.infrastructure.database.Dialect;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Packaged JSON form of an upgrade step.
 * Maps to {@code schema/upgrades/<tag>/upgrade_from_<N>_to_<M>.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpgradeStepDefinition {
    
    @NotBlank(message = "Dialect is required (e.g., 'postgresql', 'oracle')")
    private String dialect;
    
    @NotNull(message = "fromVersion is required")
    private Integer fromVersion;
    
    @NotNull(message = "toVersion is required")
    private Integer toVersion;
    
    private String description;
    
    @NotEmpty(message = "At least one schema operation is required")
    @Valid
    private List<Operation> operations;
    
    @Valid
    @Builder.Default
    private List<Backfill> backfills = new ArrayList<>();
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Operation {
        private String description;
        
        @NotBlank(message = "Operation SQL is required")
        private String sql;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Backfill {
        @NotBlank(message = "Backfill table is required")
        private String table;
        
        private String resourceIdColumn;
        
        private String predicate;
        
        @NotBlank(message = "Work table is required")
        private String workTable;
        
        @NotBlank(message = "Work type is required")
        private String workType;
    }
    
    /**
     * Convert to the engine's step model.
     */
    public UpgradeStep toStep() {
        UpgradeStep.UpgradeStepBuilder builder = UpgradeStep.builder()
            .dialect(Dialect.fromString(dialect))
            .fromVersion(fromVersion)
            .toVersion(toVersion)
            .description(description);
        
        for (Operation operation : operations) {
            builder.operation(new SchemaOperation(operation.getDescription(), operation.getSql()));
        }
        if (backfills != null) {
            for (Backfill backfill : backfills) {
                BackfillSpec.BackfillSpecBuilder spec = BackfillSpec.builder()
                    .table(backfill.getTable())
                    .predicate(backfill.getPredicate())
                    .workTable(backfill.getWorkTable())
                    .workType(backfill.getWorkType());
                if (backfill.getResourceIdColumn() != null) {
                    spec.resourceIdColumn(backfill.getResourceIdColumn());
                }
                builder.backfill(spec.build());
            }
        }
        return builder.build();
    }
}
