package com.poc.upgrade.registry;

import lombok.NonNull;
import lombok.Value;

/**
 * One DDL statement of an upgrade step.
 */
@Value
public class SchemaOperation {
    String description;
    @NonNull String sql;

    public static SchemaOperation of(String sql) {
        return new SchemaOperation(null, sql);
    }
}
