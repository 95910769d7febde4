package com.poc.upgrade.infrastructure.database;

import lombok.Getter;

/**
 * Enumeration of supported SQL dialects with the metadata the upgrade engine needs.
 */
@Getter
public enum Dialect {
    POSTGRESQL("postgresql", "postgres-dialect", "PostgreSQL", 9, true, true, " for update skip locked"),
    ORACLE("oracle", "oracle-dialect", "Oracle", 12, false, true, " for update skip locked"),
    SQLITE("sqlite", "sqlite-dialect", "SQLite", 3, true, false, "");

    private final String typeName;

    /**
     * Directory tag under which this dialect's upgrade steps are packaged.
     */
    private final String tag;

    /**
     * Product name reported by the JDBC driver.
     */
    private final String productName;

    private final int minimumMajorVersion;

    /**
     * Whether DDL statements take part in the surrounding transaction.
     * Oracle commits implicitly around every DDL statement.
     */
    private final boolean transactionalDdl;

    /**
     * Whether new row ids come from a named sequence. Otherwise the row id is
     * assigned on insert and read back from the connection.
     */
    private final boolean sequenceIds;

    /**
     * Suffix appended to a select to lock the returned rows for the transaction.
     */
    private final String rowLockClause;

    Dialect(String typeName, String tag, String productName, int minimumMajorVersion,
            boolean transactionalDdl, boolean sequenceIds, String rowLockClause) {
        this.typeName = typeName;
        this.tag = tag;
        this.productName = productName;
        this.minimumMajorVersion = minimumMajorVersion;
        this.transactionalDdl = transactionalDdl;
        this.sequenceIds = sequenceIds;
        this.rowLockClause = rowLockClause;
    }

    /**
     * Parse dialect from its type name or tag (case-insensitive).
     */
    public static Dialect fromString(String type) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("Dialect cannot be null or empty");
        }
        
        for (Dialect dialect : values()) {
            if (dialect.typeName.equalsIgnoreCase(type) || dialect.tag.equalsIgnoreCase(type)) {
                return dialect;
            }
        }
        
        throw new IllegalArgumentException("Unsupported dialect: " + type);
    }

    /**
     * Check if this dialect matches the product name reported by a driver.
     */
    public boolean matchesProduct(String reportedProductName) {
        return reportedProductName != null
            && reportedProductName.toLowerCase().startsWith(productName.toLowerCase());
    }

    /**
     * Query returning the next value of a sequence.
     */
    public String nextValueQuery(String sequence) {
        switch (this) {
            case POSTGRESQL:
                return "select nextval('" + sequence + "')";
            case ORACLE:
                return "select " + sequence + ".nextval from dual";
            default:
                throw new UnsupportedOperationException(typeName + " does not use sequences");
        }
    }

    /**
     * Query returning the row id assigned by the last insert on the current connection.
     */
    public String lastInsertIdQuery() {
        if (this == SQLITE) {
            return "select last_insert_rowid()";
        }
        throw new UnsupportedOperationException(typeName + " allocates ids from sequences");
    }
}
